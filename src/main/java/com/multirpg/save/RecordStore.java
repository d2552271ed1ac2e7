package com.multirpg.save;

import java.util.List;

/**
 * Durable mirror of the player table and event log.
 * <p>
 * The in-memory table is authoritative; implementations only persist what they
 * are handed and never decide gameplay. Calls arrive from one writer thread.
 */
public interface RecordStore extends AutoCloseable {

    /** Every stored player with its items. */
    List<PlayerRecord> loadPlayers() throws StoreException;

    /** The newest {@code limit} events, newest first. */
    List<EventRecord> recentEvents(int limit) throws StoreException;

    /** Highest event id in the store, 0 when empty. */
    long maxEventId() throws StoreException;

    /** Insert or update the player row and replace its item rows. */
    void savePlayer(PlayerRecord record) throws StoreException;

    /** Remove the player row; its items go with it. */
    void deletePlayer(long playerId) throws StoreException;

    /** Append one event row. */
    void appendEvent(EventRecord event) throws StoreException;

    @Override
    void close() throws StoreException;
}
