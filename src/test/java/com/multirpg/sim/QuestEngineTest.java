package com.multirpg.sim;

import com.multirpg.math.GameRandom;
import com.multirpg.world.GameException;
import com.multirpg.world.MutableClock;
import com.multirpg.world.PasswordHasher;
import com.multirpg.world.Player;
import com.multirpg.world.PlayerStore;
import com.multirpg.world.QuestState;
import com.multirpg.world.StoreTx;
import com.multirpg.world.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuestEngineTest {

    private MutableClock clock;
    private PlayerStore store;
    private final QuestEngine quests = new QuestEngine(new PenaltyCalculator(0));

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000L);
        store = new PlayerStore(new WorldState(clock.seconds()), new GameRandom(5), clock,
            new PasswordHasher(1000));
    }

    /** Online players at level 40, logged in at the current clock. */
    private void veterans(int count) throws GameException {
        store.transact(tx -> {
            for (int i = 0; i < count; i++) {
                Player p = tx.createPlayer("hero" + i, "net1", "hash", "Hero");
                tx.setOnline(p, "hero" + i, "#rpg", "hero" + i + "!u@host");
                p.setLevel(QuestEngine.MIN_LEVEL);
            }
            return null;
        });
    }

    private static List<Long> ids(StoreTx tx, int count) {
        List<Long> out = new ArrayList<>();
        for (Player p : tx.onlinePlayers()) {
            if (out.size() < count) out.add(p.getId());
        }
        return out;
    }

    @Test
    void threeVeteransAreNotEnough() throws GameException {
        veterans(3);
        clock.advance(QuestEngine.MIN_ONLINE_SECONDS);

        boolean started = store.transact(tx -> quests.start(tx, tx.onlinePlayers()));

        assertFalse(started);
    }

    @Test
    void playersMustHaveIdledTenHours() throws GameException {
        veterans(4);
        clock.advance(QuestEngine.MIN_ONLINE_SECONDS - 1);

        boolean started = store.transact(tx -> quests.start(tx, tx.onlinePlayers()));

        assertFalse(started);
    }

    @Test
    void fourVeteransStartAQuest() throws GameException {
        veterans(5);
        clock.advance(QuestEngine.MIN_ONLINE_SECONDS);

        boolean started = store.transact(tx -> quests.start(tx, tx.onlinePlayers()));

        assertTrue(started);

        store.transact(tx -> {
            QuestState q = tx.world().getQuest();
            assertTrue(q.isActive());
            assertEquals(4, q.getQuesterIds().size());
            assertTrue(quests.describe(tx).contains(" are questing to "));
            return null;
        });
        assertEquals("quest", store.snapshot().events().get(0).kind());
    }

    @Test
    void describeWithoutQuest() throws GameException {
        String text = store.transact(quests::describe);
        assertEquals("There is no active quest.", text);
    }

    @Test
    void timeQuestCompletesAfterTheDeadline() throws GameException {
        veterans(4);
        store.transact(tx -> {
            for (Player p : tx.onlinePlayers()) p.setTtl(1000);
            tx.world().getQuest().startTimeQuest("slay the dragon", ids(tx, 4), tx.now() + 10);
            return null;
        });
        clock.advance(11);

        store.transact(tx -> {
            quests.check(tx, tx.onlinePlayers());
            QuestState q = tx.world().getQuest();
            assertFalse(q.isActive());
            assertEquals(tx.now() + QuestEngine.AFTER_TIME_QUEST, q.getNextQuestTime());
            for (Player p : tx.onlinePlayers()) assertEquals(750, p.getTtl());
            return null;
        });
    }

    @Test
    void gridQuestNeedsEveryQuesterOnTheWaypoint() throws GameException {
        veterans(4);
        store.transact(tx -> {
            List<Player> team = tx.onlinePlayers();
            for (Player p : team) {
                p.moveTo(10, 10);
                p.setTtl(1000);
            }
            team.get(3).moveTo(11, 10);
            tx.world().getQuest().startGridQuest("find the grail", ids(tx, 4), 10, 10, 20, 20);

            quests.checkGrid(tx);
            assertEquals(1, tx.world().getQuest().getStage());

            team.get(3).moveTo(10, 10);
            quests.checkGrid(tx);
            assertEquals(2, tx.world().getQuest().getStage());

            for (Player p : team) p.moveTo(20, 20);
            tx.setOffline(team.get(0));
            quests.checkGrid(tx);
            assertTrue(tx.world().getQuest().isActive());

            tx.setOnline(team.get(0), "hero0", "#rpg", "hero0!u@host");
            quests.checkGrid(tx);
            assertFalse(tx.world().getQuest().isActive());
            assertEquals(750, team.get(1).getTtl());
            return null;
        });
    }

    @Test
    void penalizedQuesterBringsWrathOnEveryone() throws GameException {
        veterans(5);
        store.transact(tx -> {
            List<Player> all = tx.onlinePlayers();
            for (Player p : all) p.setTtl(1000);
            tx.world().getQuest().startTimeQuest("slay the dragon", ids(tx, 4), tx.now() + 50_000);

            Player bystander = all.get(4);
            assertFalse(quests.wrath(tx, bystander));
            assertTrue(tx.world().getQuest().isActive());

            assertTrue(quests.wrath(tx, all.get(0)));
            assertFalse(tx.world().getQuest().isActive());
            assertEquals(tx.now() + QuestEngine.AFTER_WRATH, tx.world().getQuest().getNextQuestTime());
            for (Player p : all) {
                long pen = p.getPenalty(PenaltyKind.QUEST);
                assertTrue(pen > 0);
                assertEquals(1000 + pen, p.getTtl());
            }
            return null;
        });
    }
}
