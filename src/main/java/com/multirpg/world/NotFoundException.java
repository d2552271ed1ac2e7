package com.multirpg.world;

/** An admin command named a username that does not exist. */
public class NotFoundException extends GameException {

    public NotFoundException(String message) {
        super(message);
    }
}
