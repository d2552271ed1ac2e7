package com.multirpg.world;

/** The invoker is not logged in, or not an admin for an admin command. */
public class UnauthorizedException extends GameException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
