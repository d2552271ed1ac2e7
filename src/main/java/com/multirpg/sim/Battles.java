package com.multirpg.sim;

import com.multirpg.math.GameRandom;
import com.multirpg.world.EventKind;
import com.multirpg.world.Item;
import com.multirpg.world.ItemSlot;
import com.multirpg.world.Player;
import com.multirpg.world.StoreTx;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.multirpg.sim.TimeFormat.duration;

/**
 * One-on-one combat and item theft. Runs inside a store transaction.
 */
public final class Battles {

    private static final Logger LOG = Logger.getLogger(Battles.class.getName());

    /** Winners above this level may steal an item. */
    static final int STEAL_MIN_LEVEL = 19;
    static final int STEAL_ODDS = 25;

    /**
     * Outcome of a duel.
     *
     * @param challengerWon challenger rolled at least as high as the opponent
     * @param amount        seconds removed from the winner, or added to the losing challenger
     * @param critical      seconds a critical strike added to the loser, 0 if none
     * @param stolen        slot taken by the winner, or null
     */
    public record Outcome(boolean challengerWon, long amount, long critical, ItemSlot stolen) { }

    /**
     * Result of a theft.
     *
     * @param stolenLevel level the thief now holds in {@code slot}
     * @param oldLevel    level the victim now holds
     */
    public record Theft(ItemSlot slot, int stolenLevel, int oldLevel) { }

    private Battles() { }

    /** Item sum plus level, scaled by alignment. */
    public static int power(Player p) {
        return p.getAlignment().adjust(p.itemSum() + p.getLevel());
    }

    /** Uniform in {@code [0, power)}; 0 for a powerless side. */
    public static int roll(GameRandom random, int power) {
        return random.randInt(0, Math.max(power - 1, 0));
    }

    /**
     * Fight {@code challenger} against {@code opponent}. The challenger wins ties.
     *
     * @param collision true when the two met on the map rather than by challenge
     */
    public static Outcome duel(StoreTx tx, Player challenger, Player opponent, boolean collision) {
        if (challenger.getId() == opponent.getId()) {
            throw new IllegalArgumentException("a player cannot fight itself");
        }
        GameRandom random = tx.random();
        int cRoll = roll(random, power(challenger));
        int oRoll = roll(random, power(opponent));
        boolean won = cRoll >= oRoll;
        Player winner = won ? challenger : opponent;
        Player loser = won ? opponent : challenger;

        String verb = collision
            ? challenger.tagWithPosition() + " has come upon " + opponent.tagWithPosition() + " and "
                + (won ? "taken them in" : "been defeated in") + " combat!"
            : challenger.tagWithPosition() + " has challenged " + opponent.tagWithPosition()
                + " in combat and " + (won ? "won" : "lost") + "!";

        String msg;
        long amount;
        long critical = 0;
        ItemSlot stolen = null;
        if (won) {
            amount = (long) (Math.max(loser.getLevel() / 4.0, 7) / 100 * winner.getTtl());
            winner.reduceTtl(amount);
            msg = verb + " " + duration(amount) + " is removed from " + winner.tag() + "'s clock.";
            tx.broadcastAll(msg);
            tx.broadcastAll(winner.tag() + " reaches next level in " + duration(winner.getTtl()) + ".");

            int odds = challenger.getAlignment().getCriticalOdds();
            if (random.randInt(0, odds - 1) < 1) {
                critical = (long) ((5 + random.randInt(0, 19)) / 100.0 * loser.getTtl());
                loser.addTime(critical);
                String cm = winner.tag() + " dealt " + loser.tag() + " a Critical Strike! "
                    + duration(critical) + " added to " + loser.tag() + "'s clock.";
                tx.broadcastAll(cm);
                tx.logEvent(EventKind.CRITICAL, cm, winner, loser);
            } else if (random.randInt(0, STEAL_ODDS - 1) < 1 && winner.getLevel() > STEAL_MIN_LEVEL) {
                Theft theft = steal(random, winner, loser);
                if (theft != null) {
                    stolen = theft.slot();
                    String label = theft.slot().label();
                    String sm = "In battle, " + loser.tag() + " dropped their level " + theft.stolenLevel()
                        + " " + label + "! " + winner.tag() + " picks it up, tossing their old level "
                        + theft.oldLevel() + " " + label + ".";
                    tx.broadcastAll(sm);
                    tx.logEvent(EventKind.STEAL, sm, winner, loser);
                }
            }
        } else {
            amount = (long) (Math.max(challenger.getLevel() / 7.0, 7) / 100 * challenger.getTtl());
            challenger.addTime(amount);
            msg = verb + " " + duration(amount) + " is added to " + challenger.tag() + "'s clock.";
            tx.broadcastAll(msg);
            tx.broadcastAll(challenger.tag() + " reaches next level in " + duration(challenger.getTtl()) + ".");
        }

        tx.logEvent(EventKind.BATTLE, msg, challenger, opponent);
        LOG.fine(() -> "[Battles] " + challenger.tag() + " vs " + opponent.tag()
            + ": " + cRoll + "/" + oRoll + (won ? " won" : " lost"));
        return new Outcome(won, amount, critical, stolen);
    }

    /**
     * Swap one slot where the victim's item beats the thief's. Both items lose
     * any unique name. Null when the victim has nothing better.
     */
    public static Theft steal(GameRandom random, Player thief, Player victim) {
        List<ItemSlot> candidates = new ArrayList<>();
        for (ItemSlot slot : ItemSlot.values()) {
            if (victim.getItemLevel(slot) > thief.getItemLevel(slot)) candidates.add(slot);
        }
        if (candidates.isEmpty()) return null;
        ItemSlot slot = random.pick(candidates);
        int thiefLevel = thief.getItemLevel(slot);
        int victimLevel = victim.getItemLevel(slot);
        thief.equip(Item.generated(slot, victimLevel));
        victim.equip(Item.generated(slot, thiefLevel));
        return new Theft(slot, victimLevel, thiefLevel);
    }
}
