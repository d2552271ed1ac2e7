package com.multirpg.world;

/**
 * Base of every recoverable gameplay error. The message is the text replied to
 * the player who caused it; nothing above the command boundary sees these.
 */
public class GameException extends Exception {

    public GameException(String message) {
        super(message);
    }
}
