package com.multirpg.world;

/** A name, class or numeric argument failed validation. */
public class ValidationException extends GameException {

    public ValidationException(String message) {
        super(message);
    }
}
