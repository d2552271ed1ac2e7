package com.multirpg.world;

/** Login failed: unknown account or wrong password. */
public class InvalidCredentialsException extends GameException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
