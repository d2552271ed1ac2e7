package com.multirpg.save;

import com.multirpg.sim.PenaltyKind;
import com.multirpg.world.Item;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of one player row plus its items, taken under the table lock
 * and written by the durable store afterwards.
 */
public record PlayerRecord(
    long id,
    String username,
    String network,
    String passwordHash,
    boolean admin,
    boolean online,
    String currentNick,
    String channel,
    String userhost,
    int level,
    long ttl,
    long nextTtl,
    int posX,
    int posY,
    String alignment,     // single-letter code
    String characterClass,
    Map<PenaltyKind, Long> penalties,
    long idled,
    long onlineSince,
    long createdAt,
    long lastLogin,
    List<Item> items
) {
    public PlayerRecord {
        Map<PenaltyKind, Long> copy = new EnumMap<>(PenaltyKind.class);
        if (penalties != null) copy.putAll(penalties);
        penalties = copy;
        items = items != null ? List.copyOf(items) : List.of();
    }

    public long penalty(PenaltyKind kind) {
        return penalties.getOrDefault(kind, 0L);
    }
}
