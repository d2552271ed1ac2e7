package com.multirpg.save;

/**
 * Immutable event log entry. Player ids are informational: deleting a player
 * leaves its events (and the ids in them) in place.
 *
 * @param id        surrogate id, assigned by the player table
 * @param kind      event kind code
 * @param message   human-readable text
 * @param player1Id first participant or null
 * @param player2Id second participant or null
 * @param createdAt epoch seconds
 */
public record EventRecord(long id, String kind, String message,
                          Long player1Id, Long player2Id, long createdAt) {
}
