package com.multirpg.world;

import com.multirpg.sim.Alignment;

import java.util.List;

/**
 * Read-only copy of a player, safe to hand outside the table lock.
 */
public record PlayerView(
    long id,
    String username,
    String network,
    String characterClass,
    Alignment alignment,
    boolean admin,
    boolean online,
    String currentNick,
    int level,
    long ttl,
    long nextTtl,
    int progressPercent,
    int x,
    int y,
    int itemSum,
    long idled,
    long lastLogin,
    List<Item> items
) {
    public PlayerView {
        items = items != null ? List.copyOf(items) : List.of();
    }

    static PlayerView of(Player p) {
        return new PlayerView(
            p.getId(), p.getUsername(), p.getNetwork(), p.getCharacterClass(),
            p.getAlignment(), p.isAdmin(), p.isOnline(), p.getCurrentNick(),
            p.getLevel(), p.getTtl(), p.getNextTtl(), p.progressPercent(),
            p.getX(), p.getY(), p.itemSum(), p.getIdled(), p.getLastLogin(),
            p.copyItems());
    }

    public String tag() { return username + "@" + network; }
}
