package com.multirpg.sim;

import com.multirpg.math.GameRandom;
import com.multirpg.world.EventKind;
import com.multirpg.world.Player;
import com.multirpg.world.QuestState;
import com.multirpg.world.StoreTx;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.logging.Logger;

import static com.multirpg.sim.TimeFormat.duration;

/**
 * Lifecycle of the world quest: start, advance, complete and fail.
 */
public class QuestEngine {

    private static final Logger LOG = Logger.getLogger(QuestEngine.class.getName());

    static final int QUESTERS = 4;
    static final int MIN_LEVEL = 40;
    /** Ten hours online before a player can be chosen. */
    static final long MIN_ONLINE_SECONDS = 36_000;

    static final int TIME_QUEST_MIN = 43_200;
    static final int TIME_QUEST_MAX = 86_400;
    static final long AFTER_TIME_QUEST = 21_600;
    static final long AFTER_GRID_QUEST = 3_600;
    static final long AFTER_WRATH = 43_200;

    /** Completion keeps this share of each quester's countdown. */
    static final double REWARD_FACTOR = 0.75;

    private final PenaltyCalculator penalties;

    public QuestEngine(PenaltyCalculator penalties) {
        this.penalties = penalties;
    }

    /**
     * Once per tick: start a quest when none is running and the wait is over,
     * or complete a time quest whose deadline has passed.
     */
    public void check(StoreTx tx, List<Player> online) {
        QuestState q = tx.world().getQuest();
        long now = tx.now();
        if (!q.isActive()) {
            if (now > q.getNextQuestTime()) start(tx, online);
            return;
        }
        if (q.getType() == QuestState.Type.TIME && now > q.getDeadline()) {
            String msg = names(tx, q) + " have blessed the realm by completing their quest! "
                + "25% of their burden is eliminated.";
            reward(tx, q);
            q.end(now + AFTER_TIME_QUEST);
            tx.logEvent(EventKind.QUEST, msg);
            tx.broadcastAll(msg);
            LOG.info("[QuestEngine] Time quest completed");
        }
    }

    /**
     * After movement: advance a grid quest when every quester stands on the
     * current waypoint; the second waypoint completes it. An offline quester
     * holds the party back.
     */
    public void checkGrid(StoreTx tx) {
        QuestState q = tx.world().getQuest();
        if (!q.isActive() || q.getType() != QuestState.Type.GRID) return;
        for (long id : q.getQuesterIds()) {
            Player p = tx.find(id);
            if (p == null || !p.isOnline() || p.getX() != q.targetX() || p.getY() != q.targetY()) return;
        }
        if (q.getStage() == 1) {
            q.advanceStage();
            return;
        }
        String msg = names(tx, q) + " have completed their journey! 25% of their burden is eliminated.";
        tx.broadcastAll(msg);
        reward(tx, q);
        q.end(tx.now() + AFTER_GRID_QUEST);
        tx.logEvent(EventKind.QUEST, msg);
        LOG.info("[QuestEngine] Grid quest completed");
    }

    /** Choose four eligible online players and announce a quest. Nothing happens with fewer. */
    public boolean start(StoreTx tx, List<Player> online) {
        long now = tx.now();
        List<Player> eligible = new ArrayList<>();
        for (Player p : online) {
            if (p.isOnline() && p.getLevel() >= MIN_LEVEL && p.getOnlineSince() > 0
                && now - p.getOnlineSince() >= MIN_ONLINE_SECONDS) {
                eligible.add(p);
            }
        }
        if (eligible.size() < QUESTERS) return false;

        GameRandom random = tx.random();
        List<Player> chosen = random.sample(eligible, QUESTERS);
        List<Long> ids = new ArrayList<>();
        StringJoiner names = new StringJoiner(", ");
        for (Player p : chosen) {
            ids.add(p.getId());
            names.add(p.tag());
        }
        ContentTables.QuestTemplate template = random.pick(ContentTables.QUESTS);
        QuestState q = tx.world().getQuest();
        String msg;
        if (template.type() == QuestState.Type.TIME) {
            int length = random.randInt(TIME_QUEST_MIN, TIME_QUEST_MAX);
            q.startTimeQuest(template.text(), ids, now + length);
            msg = names + " have been chosen by the gods to " + template.text()
                + ". Quest ends in " + duration(length) + ".";
        } else {
            int x1 = random.randInt(0, Player.MAP_WIDTH - 1);
            int y1 = random.randInt(0, Player.MAP_HEIGHT - 1);
            int x2 = random.randInt(0, Player.MAP_WIDTH - 1);
            int y2 = random.randInt(0, Player.MAP_HEIGHT - 1);
            q.startGridQuest(template.text(), ids, x1, y1, x2, y2);
            msg = names + " have been chosen by the gods to " + template.text()
                + ". First reach [" + x1 + "," + y1 + "], then [" + x2 + "," + y2 + "].";
        }
        tx.logEvent(EventKind.QUEST, msg);
        tx.broadcastAll(msg);
        LOG.info("[QuestEngine] Quest started: " + template.text());
        return true;
    }

    /**
     * A quester was penalized: the quest fails and every online player pays
     * for it. Returns false when {@code offender} is not on the active quest.
     */
    public boolean wrath(StoreTx tx, Player offender) {
        QuestState q = tx.world().getQuest();
        if (!q.isQuester(offender.getId())) return false;
        q.end(tx.now() + AFTER_WRATH);
        for (Player p : tx.onlinePlayers()) {
            p.addPenalty(PenaltyKind.QUEST, penalties.penalty(PenaltyKind.QUEST, p.getLevel(), 0));
        }
        String msg = offender.tag() + "'s actions have brought the wrath of the gods upon the realm. "
            + "Hell rains down upon you all.";
        tx.broadcastAll(msg);
        tx.logEvent(EventKind.QUEST, msg, offender.getId(), null);
        LOG.info("[QuestEngine] Quest failed by " + offender.tag());
        return true;
    }

    /** Reply text for the QUEST command. */
    public String describe(StoreTx tx) {
        QuestState q = tx.world().getQuest();
        if (!q.isActive()) return "There is no active quest.";
        String head = names(tx, q) + " are questing to " + q.getText() + ". ";
        if (q.getType() == QuestState.Type.TIME) {
            return head + "Ends in " + duration(Math.max(0, q.getDeadline() - tx.now())) + ".";
        }
        return head + "Must reach [" + q.firstX() + "," + q.firstY() + "] then ["
            + q.secondX() + "," + q.secondY() + "]. Heading to ["
            + q.targetX() + "," + q.targetY() + "].";
    }

    private static void reward(StoreTx tx, QuestState q) {
        for (long id : q.getQuesterIds()) {
            Player p = tx.find(id);
            if (p != null) p.setTtl((long) (p.getTtl() * REWARD_FACTOR));
        }
    }

    private static String names(StoreTx tx, QuestState q) {
        StringJoiner names = new StringJoiner(", ");
        for (long id : q.getQuesterIds()) {
            Player p = tx.find(id);
            if (p != null) names.add(p.tag());
        }
        return names.toString();
    }
}
