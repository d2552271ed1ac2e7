package com.multirpg.sim;

import com.multirpg.math.GameRandom;
import com.multirpg.world.Broadcast;
import com.multirpg.world.EventKind;
import com.multirpg.world.Item;
import com.multirpg.world.ItemSlot;
import com.multirpg.world.Player;
import com.multirpg.world.QuestState;
import com.multirpg.world.StoreTx;
import it.unimi.dsi.fastutil.ints.Int2LongOpenHashMap;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.multirpg.sim.TimeFormat.duration;

/**
 * Per-tick advancement of online players: countdown, level-ups with their item
 * drop and challenge, and movement on the map.
 * <p>
 * All methods run inside the tick transaction and work on the online list the
 * tick captured at its start.
 */
public class ProgressionEngine {

    private static final Logger LOG = Logger.getLogger(ProgressionEngine.class.getName());

    /** Level from which unique items can drop and every level-up challenges someone. */
    static final int HIGH_LEVEL = 25;
    static final double CHALLENGE_CHANCE = 0.25;
    static final int UNIQUE_ODDS = 40;
    /** Chance per sub-step that a grid quester walks toward the waypoint. */
    static final double QUEST_STEP_CHANCE = 0.01;

    private static final long NO_OCCUPANT = -1L;
    private static final long FOUGHT = -2L;

    /** Called when two players end a movement sub-step on the same cell. */
    @FunctionalInterface
    public interface CollisionHandler {
        void collide(StoreTx tx, Player mover, Player occupant);
    }

    // ---- Countdown ----

    /**
     * Take {@code interval} seconds off every online player's countdown.
     * Returns the players whose countdown ran out, in input order; their
     * countdown is left at zero for {@link #levelUp}.
     */
    public List<Player> countdown(List<Player> online, int interval) {
        List<Player> levelled = new ArrayList<>();
        for (Player p : online) {
            long next = p.getTtl() - interval;
            p.addIdled(interval);
            if (next < 1) {
                p.setTtl(0);
                levelled.add(p);
            } else {
                p.setTtl(next);
            }
        }
        return levelled;
    }

    // ---- Level up ----

    /**
     * Raise the level by one, reset the countdown, roll an item and maybe
     * challenge a random other online player.
     */
    public void levelUp(StoreTx tx, Player p, List<Player> online) {
        int newLevel = p.getLevel() + 1;
        int ttl = PenaltyCalculator.baseTtl(newLevel);
        p.setLevel(newLevel);
        p.setTtl(ttl);
        p.setNextTtl(ttl);

        tx.broadcastAll(p.tag() + ", the " + p.getCharacterClass() + ", has attained level "
            + newLevel + "! Next level in " + duration(ttl) + ".");
        tx.logEvent(EventKind.LEVELUP, p.getUsername() + " reached level " + newLevel, p);
        LOG.info("[ProgressionEngine] Level up: " + p.tag() + " -> " + newLevel);

        findItem(tx, p, newLevel);

        List<Player> opponents = new ArrayList<>();
        for (Player o : online) {
            if (o.getId() != p.getId() && o.isOnline()) opponents.add(o);
        }
        if (!opponents.isEmpty()
            && (newLevel >= HIGH_LEVEL || tx.random().chance(CHALLENGE_CHANCE))) {
            Battles.duel(tx, p, tx.random().pick(opponents), false);
        }
    }

    /**
     * Roll the item found at {@code level}: at high levels each unique item whose
     * requirement is met gets a 1 in 40 chance, first hit wins. Otherwise a
     * generated item in a random slot.
     */
    public static Item rollItem(GameRandom random, int level) {
        if (level >= HIGH_LEVEL) {
            for (ContentTables.UniqueItem u : ContentTables.UNIQUE_ITEMS) {
                if (level >= u.requiredLevel() && random.nextDouble() < 1.0 / UNIQUE_ODDS) {
                    return new Item(u.slot(), random.randInt(u.minLevel(), u.maxLevel() - 1), u.name(), true);
                }
            }
        }
        int maxLevel = (int) (level * 1.5);
        int itemLevel = 1;
        for (int n = 1; n <= maxLevel; n++) {
            if (random.nextDouble() < 1 / Math.pow(1.4, n / 4.0)) itemLevel = n;
        }
        ItemSlot[] slots = ItemSlot.values();
        return Item.generated(slots[random.nextInt(slots.length)], itemLevel);
    }

    /** Roll an item and keep it if it beats the one in its slot. The player gets a notice either way. */
    public void findItem(StoreTx tx, Player p, int level) {
        Item found = rollItem(tx.random(), level);
        int current = p.getItemLevel(found.slot());
        String slot = found.slot().label();
        String text;
        if (found.level() > current) {
            p.equip(found);
            text = found.unique()
                ? uniqueMessage(found)
                : "You found a level " + found.level() + " " + slot + "! Your current " + slot
                    + " is only level " + current + ", so it seems Luck is with you!";
        } else {
            text = "You found a level " + found.level() + " " + slot + ". Your current " + slot
                + " is level " + current + ", so it seems Luck is against you. You toss the " + slot + ".";
        }
        String nick = p.getCurrentNick() != null ? p.getCurrentNick() : p.getUsername();
        tx.broadcast(Broadcast.notice(p.getNetwork(), nick, text));
    }

    private static String uniqueMessage(Item item) {
        for (ContentTables.UniqueItem u : ContentTables.UNIQUE_ITEMS) {
            if (u.name().equals(item.name())) return u.findMessage(item.level());
        }
        return "You found the level " + item.level() + " " + item.displayName() + "!";
    }

    // ---- Movement ----

    /**
     * Move every online player {@code interval} single steps. Grid questers
     * occasionally head for their waypoint; everyone else wanders. After each
     * step the first pair found sharing a cell is handed to {@code collisions};
     * a cell hosts at most one fight per step.
     */
    public void move(StoreTx tx, List<Player> online, int interval, CollisionHandler collisions) {
        GameRandom random = tx.random();
        QuestState quest = tx.world().getQuest();
        boolean gridQuest = quest.isActive() && quest.getType() == QuestState.Type.GRID;
        // cell → occupant id, or FOUGHT once a fight happened there this step
        Int2LongOpenHashMap cells = new Int2LongOpenHashMap();
        cells.defaultReturnValue(NO_OCCUPANT);

        for (int step = 0; step < interval; step++) {
            cells.clear();
            for (Player p : online) {
                if (!p.isOnline()) continue;
                int dx;
                int dy;
                if (gridQuest && quest.isQuester(p.getId()) && random.chance(QUEST_STEP_CHANCE)) {
                    dx = Integer.signum(quest.targetX() - p.getX());
                    dy = Integer.signum(quest.targetY() - p.getY());
                } else {
                    dx = random.randInt(-1, 1);
                    dy = random.randInt(-1, 1);
                }
                p.moveTo(p.getX() + dx, p.getY() + dy);

                int cell = p.getX() * Player.MAP_HEIGHT + p.getY();
                long occupant = cells.get(cell);
                if (occupant == NO_OCCUPANT) {
                    cells.put(cell, p.getId());
                } else if (occupant != FOUGHT && occupant != p.getId()) {
                    cells.put(cell, FOUGHT);
                    Player other = tx.find(occupant);
                    if (other != null && other.isOnline()) collisions.collide(tx, p, other);
                }
            }
        }
    }
}
