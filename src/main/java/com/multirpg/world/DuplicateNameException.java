package com.multirpg.world;

/** A registration or rename collided with an existing name (case-insensitive, world-wide). */
public class DuplicateNameException extends GameException {

    public DuplicateNameException(String message) {
        super(message);
    }
}
