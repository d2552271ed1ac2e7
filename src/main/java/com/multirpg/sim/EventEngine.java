package com.multirpg.sim;

import com.multirpg.math.GameRandom;
import com.multirpg.world.EventKind;
import com.multirpg.world.Item;
import com.multirpg.world.ItemSlot;
import com.multirpg.world.Player;
import com.multirpg.world.StoreTx;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.logging.Logger;

import static com.multirpg.sim.TimeFormat.duration;

/**
 * Random world events: Hand of God, duels on the map, team battles,
 * calamities, godsends, the alignment events and the periodic announcements.
 * <p>
 * Each daily event fires with probability {@code count / (days × 86400 / interval)}
 * per tick, so on average once every {@code days} days per participant.
 */
public class EventEngine {

    private static final Logger LOG = Logger.getLogger(EventEngine.class.getName());

    static final int HOG_DAYS = 20;
    static final int TEAM_BATTLE_DAYS = 24;
    static final int CALAMITY_DAYS = 8;
    static final int GODSEND_DAYS = 4;
    static final int EVILNESS_DAYS = 8;
    static final int GOODNESS_DAYS = 12;

    static final int TEAM_SIZE = 3;
    static final int HIGH_LEVEL = 45;
    static final long HIGH_LEVEL_BATTLE_PERIOD = 1200;
    static final long TOP_REPORT_PERIOD = 36_000;

    /**
     * Result of one Hand of God.
     *
     * @param playerId the player touched
     * @param helped   true when the countdown went down
     * @param percent  5 to 75
     * @param amount   seconds moved
     * @param ttlBefore countdown before the event
     */
    public record HogOutcome(long playerId, boolean helped, int percent, long amount, long ttlBefore) { }

    // ---- Daily rolls ----

    /** Roll every daily event once. */
    public void rollDaily(StoreTx tx, List<Player> online, int interval) {
        if (online.isEmpty()) return;
        GameRandom random = tx.random();
        int n = online.size();
        int evil = 0;
        int good = 0;
        for (Player p : online) {
            switch (p.getAlignment()) {
                case EVIL -> evil++;
                case GOOD -> good++;
                default -> { }
            }
        }
        if (random.nextDouble() < odds(n, HOG_DAYS, interval)) handOfGod(tx, online);
        if (random.nextDouble() < odds(n, TEAM_BATTLE_DAYS, interval)) teamBattle(tx, online);
        if (random.nextDouble() < odds(n, CALAMITY_DAYS, interval)) calamity(tx, online);
        if (random.nextDouble() < odds(n, GODSEND_DAYS, interval)) godsend(tx, online);
        if (random.nextDouble() < odds(evil, EVILNESS_DAYS, interval)) evilness(tx, online);
        if (random.nextDouble() < odds(good, GOODNESS_DAYS, interval)) goodness(tx, online);
    }

    static double odds(int count, int days, int interval) {
        return count / ((days * 86400.0) / interval);
    }

    // ---- Hand of God ----

    /**
     * Pick one online player. Four times in five the countdown drops by 5-75%
     * of its current value, otherwise it grows by the same range. Null when
     * nobody is online.
     */
    public HogOutcome handOfGod(StoreTx tx, List<Player> online) {
        List<Player> candidates = stillOnline(online);
        if (candidates.isEmpty()) return null;
        GameRandom random = tx.random();
        Player p = random.pick(candidates);
        boolean helping = random.randInt(0, 4) > 0;
        int percent = 5 + random.randInt(0, 70);
        long before = p.getTtl();
        long amount = (long) (percent / 100.0 * before);
        String msg;
        if (helping) {
            p.reduceTtl(amount);
            msg = "Verily I say unto thee, the Heavens have burst forth, and the blessed hand of God carried "
                + p.tag() + " " + duration(amount) + " toward level " + (p.getLevel() + 1) + ".";
        } else {
            p.addTime(amount);
            msg = "Thereupon He stretched out His little finger among them and consumed " + p.tag()
                + " with fire, slowing the heathen " + duration(amount) + " from level " + (p.getLevel() + 1) + ".";
        }
        tx.broadcastAll(msg);
        tx.broadcastAll(p.tag() + " reaches next level in " + duration(p.getTtl()) + ".");
        tx.logEvent(EventKind.HOG, msg, p);
        LOG.info("[EventEngine] Hand of God " + (helping ? "helped " : "hurt ") + p.tag() + " by " + amount + "s");
        return new HogOutcome(p.getId(), helping, percent, amount, before);
    }

    // ---- Duels ----

    /** Two players met on the map. */
    public void collision(StoreTx tx, Player mover, Player occupant) {
        Battles.duel(tx, mover, occupant, true);
    }

    /** Three against three; the first team's weakest countdown sets the stake. */
    public void teamBattle(StoreTx tx, List<Player> online) {
        List<Player> candidates = stillOnline(online);
        if (candidates.size() < TEAM_SIZE * 2) return;
        GameRandom random = tx.random();
        List<Player> picked = random.sample(candidates, TEAM_SIZE * 2);
        List<Player> teamA = picked.subList(0, TEAM_SIZE);
        List<Player> teamB = picked.subList(TEAM_SIZE, TEAM_SIZE * 2);
        int powerA = teamPower(teamA);
        int powerB = teamPower(teamB);
        int rollA = Battles.roll(random, powerA);
        int rollB = Battles.roll(random, powerB);
        boolean won = rollA >= rollB;
        long lowest = Long.MAX_VALUE;
        for (Player p : teamA) lowest = Math.min(lowest, p.getTtl());
        long stake = (long) (lowest * 0.20);
        String msg = tags(teamA) + " [" + rollA + "/" + powerA + "] team battled "
            + tags(teamB) + " [" + rollB + "/" + powerB + "] and " + (won ? "won" : "lost") + "! "
            + duration(stake) + " " + (won ? "removed from" : "added to") + " their clocks.";
        for (Player p : teamA) {
            if (won) p.reduceTtl(stake); else p.addTime(stake);
        }
        tx.broadcastAll(msg);
        tx.logEvent(EventKind.TEAM_BATTLE, msg);
    }

    private static int teamPower(List<Player> team) {
        int sum = 0;
        for (Player p : team) sum += Battles.power(p);
        return sum;
    }

    // ---- Calamity and godsend ----

    /** One in ten times an item loses 10%; otherwise 5-12% is added to the countdown. */
    public void calamity(StoreTx tx, List<Player> online) {
        List<Player> candidates = stillOnline(online);
        if (candidates.isEmpty()) return;
        GameRandom random = tx.random();
        Player p = random.pick(candidates);
        if (random.nextDouble() < 0.1) {
            ItemSlot slot = random.pick(ContentTables.CHANGEABLE_SLOTS);
            scaleItem(p, slot, -0.10);
            String msg = String.format(ContentTables.CALAMITY_ITEM_LINES.get(slot), p.tag())
                + "! " + p.tag() + "'s " + slot.label() + " loses 10% effectiveness.";
            tx.broadcastAll(msg);
            tx.logEvent(EventKind.CALAMITY, msg, p);
            return;
        }
        long amount = (long) ((5 + random.randInt(0, 7)) / 100.0 * p.getTtl());
        p.addTime(amount);
        String msg = String.format(random.pick(ContentTables.CALAMITY_LINES), p.tag())
            + ". This calamity slowed them " + duration(amount) + " from level " + (p.getLevel() + 1) + ".";
        tx.broadcastAll(msg);
        tx.broadcastAll(p.tag() + " reaches next level in " + duration(p.getTtl()) + ".");
        tx.logEvent(EventKind.CALAMITY, msg, p);
    }

    /** One in ten times an item gains 10%; otherwise 5-12% is taken off the countdown. */
    public void godsend(StoreTx tx, List<Player> online) {
        List<Player> candidates = stillOnline(online);
        if (candidates.isEmpty()) return;
        GameRandom random = tx.random();
        Player p = random.pick(candidates);
        if (random.nextDouble() < 0.1) {
            ItemSlot slot = random.pick(ContentTables.CHANGEABLE_SLOTS);
            scaleItem(p, slot, 0.10);
            String msg = String.format(ContentTables.GODSEND_ITEM_LINES.get(slot), p.tag())
                + "! " + p.tag() + "'s " + slot.label() + " gains 10% effectiveness.";
            tx.broadcastAll(msg);
            tx.logEvent(EventKind.GODSEND, msg, p);
            return;
        }
        long amount = (long) ((5 + random.randInt(0, 7)) / 100.0 * p.getTtl());
        p.reduceTtl(amount);
        String msg = String.format(random.pick(ContentTables.GODSEND_LINES), p.tag())
            + "! This godsend accelerated them " + duration(amount) + " towards level " + (p.getLevel() + 1) + ".";
        tx.broadcastAll(msg);
        tx.broadcastAll(p.tag() + " reaches next level in " + duration(p.getTtl()) + ".");
        tx.logEvent(EventKind.GODSEND, msg, p);
    }

    /** Scale an item by {@code 1 + fraction}, rounded. Empty or level 0 slots are left alone. */
    static void scaleItem(Player p, ItemSlot slot, double fraction) {
        Item item = p.getItem(slot);
        if (item == null || item.level() == 0) return;
        p.equip(item.withLevel((int) Math.max(0, Math.round(item.level() * (1 + fraction)))));
    }

    // ---- Alignment events ----

    /** Two good players pray together and lose 5-12% of their countdowns. */
    public void goodness(StoreTx tx, List<Player> online) {
        List<Player> good = new ArrayList<>();
        for (Player p : stillOnline(online)) {
            if (p.getAlignment() == Alignment.GOOD) good.add(p);
        }
        if (good.size() < 2) return;
        GameRandom random = tx.random();
        List<Player> pair = random.sample(good, 2);
        int gain = 5 + random.randInt(0, 7);
        String msg = pair.get(0).tag() + " and " + pair.get(1).tag() + " have prayed together. "
            + gain + "% of their time is removed.";
        tx.broadcastAll(msg);
        for (Player p : pair) {
            p.setTtl((long) (p.getTtl() * (1 - gain / 100.0)));
            tx.broadcastAll(p.tag() + " reaches next level in " + duration(p.getTtl()) + ".");
        }
        tx.logEvent(EventKind.GODSEND, msg, pair.get(0), pair.get(1));
    }

    /** An evil player either robs a good one or is punished by their god. */
    public void evilness(StoreTx tx, List<Player> online) {
        List<Player> evil = new ArrayList<>();
        List<Player> good = new ArrayList<>();
        for (Player p : stillOnline(online)) {
            if (p.getAlignment() == Alignment.EVIL) evil.add(p);
            else if (p.getAlignment() == Alignment.GOOD) good.add(p);
        }
        if (evil.isEmpty()) return;
        GameRandom random = tx.random();
        Player me = random.pick(evil);
        if (random.nextDouble() < 0.5) {
            if (good.isEmpty()) return;
            Player target = random.pick(good);
            Battles.Theft theft = Battles.steal(random, me, target);
            if (theft == null) return;
            String label = theft.slot().label();
            String msg = me.tag() + " stole " + target.tag() + "'s level " + theft.stolenLevel() + " " + label
                + "! Leaves their old level " + theft.oldLevel() + " " + label + " behind.";
            tx.broadcastAll(msg);
            tx.logEvent(EventKind.STEAL, msg, me, target);
            return;
        }
        long amount = me.getTtl() * (1 + random.randInt(0, 4)) / 100;
        me.addTime(amount);
        String msg = me.tag() + " is forsaken by their evil god. " + duration(amount) + " added to their clock.";
        tx.broadcastAll(msg);
        tx.broadcastAll(me.tag() + " reaches next level in " + duration(me.getTtl()) + ".");
        tx.logEvent(EventKind.CALAMITY, msg, me);
    }

    // ---- Periodic ----

    /**
     * Announcements keyed to elapsed game time: the top three every ten hours,
     * a high-level battle every twenty minutes.
     */
    public void periodic(StoreTx tx, List<Player> online, long reportSeconds) {
        if (reportSeconds % TOP_REPORT_PERIOD == 0) announceTop(tx);
        if (reportSeconds % HIGH_LEVEL_BATTLE_PERIOD == 0) highLevelBattle(tx, online);
    }

    public void announceTop(StoreTx tx) {
        List<Player> ranked = tx.ranked();
        if (ranked.isEmpty()) return;
        tx.broadcastAll("Idle RPG Top Players:");
        for (int i = 0; i < Math.min(3, ranked.size()); i++) {
            Player p = ranked.get(i);
            tx.broadcastAll(p.tag() + ", the level " + p.getLevel() + " " + p.getCharacterClass()
                + ", is #" + (i + 1) + "! Next level in " + duration(p.getTtl()) + ".");
        }
    }

    /** When more than 15% of online players are level 45+, one of them challenges someone. */
    public void highLevelBattle(StoreTx tx, List<Player> online) {
        List<Player> candidates = stillOnline(online);
        if (candidates.isEmpty()) return;
        List<Player> high = new ArrayList<>();
        for (Player p : candidates) {
            if (p.getLevel() >= HIGH_LEVEL) high.add(p);
        }
        if (high.isEmpty() || (double) high.size() / candidates.size() <= 0.15) return;
        GameRandom random = tx.random();
        Player challenger = random.pick(high);
        List<Player> others = new ArrayList<>();
        for (Player p : candidates) {
            if (p.getId() != challenger.getId()) others.add(p);
        }
        if (others.isEmpty()) return;
        Battles.duel(tx, challenger, random.pick(others), false);
    }

    // ---- Helpers ----

    private static List<Player> stillOnline(List<Player> online) {
        List<Player> out = new ArrayList<>(online.size());
        for (Player p : online) {
            if (p.isOnline()) out.add(p);
        }
        return out;
    }

    private static String tags(List<Player> players) {
        StringJoiner j = new StringJoiner(", ");
        for (Player p : players) j.add(p.tag());
        return j.toString();
    }
}
