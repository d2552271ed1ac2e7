package com.multirpg.world;

/** Item slot outside the fixed set, or a second item for an occupied slot. */
public class ConstraintViolationException extends GameException {

    public ConstraintViolationException(String message) {
        super(message);
    }
}
