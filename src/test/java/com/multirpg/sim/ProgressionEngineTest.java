package com.multirpg.sim;

import com.multirpg.math.GameRandom;
import com.multirpg.world.Broadcast;
import com.multirpg.world.DuplicateNameException;
import com.multirpg.world.GameException;
import com.multirpg.world.Item;
import com.multirpg.world.MutableClock;
import com.multirpg.world.PasswordHasher;
import com.multirpg.world.Player;
import com.multirpg.world.PlayerStore;
import com.multirpg.world.StoreTx;
import com.multirpg.world.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressionEngineTest {

    private PlayerStore store;
    private final ProgressionEngine engine = new ProgressionEngine();

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(1_700_000_000L);
        store = new PlayerStore(new WorldState(clock.seconds() + 3600), new GameRandom(7), clock,
            new PasswordHasher(1000));
    }

    private static Player online(StoreTx tx, String name) throws DuplicateNameException {
        Player p = tx.createPlayer(name, "net1", "hash", "Tester");
        tx.setOnline(p, name, "#rpg", name + "!u@host");
        return p;
    }

    @Test
    void countdownTakesTheIntervalAndReportsFinishedPlayers() throws GameException {
        store.transact(tx -> {
            Player a = online(tx, "a");
            Player b = online(tx, "b");
            Player c = online(tx, "c");
            a.setTtl(600);
            b.setTtl(3);
            c.setTtl(5);

            List<Player> done = engine.countdown(List.of(a, b, c), 5);

            assertEquals(List.of(b, c), done);
            assertEquals(595, a.getTtl());
            assertEquals(0, b.getTtl());
            assertEquals(0, c.getTtl());
            assertEquals(5, a.getIdled());
            return null;
        });
    }

    @Test
    void levelUpResetsTheCountdownAndAlwaysFindsAnItemAtLevelOne() throws GameException {
        List<Broadcast> out = store.transact(tx -> {
            Player a = online(tx, "Alice");
            engine.levelUp(tx, a, List.of(a));

            assertEquals(1, a.getLevel());
            assertEquals(PenaltyCalculator.baseTtl(1), a.getTtl());
            assertEquals(PenaltyCalculator.baseTtl(1), a.getNextTtl());
            assertEquals(1, a.itemSum());
            return tx.broadcasts();
        });

        assertTrue(out.stream().anyMatch(b -> b.scope() == Broadcast.Scope.ALL
            && b.text().contains("has attained level 1")));
        assertTrue(out.stream().anyMatch(b -> b.scope() == Broadcast.Scope.NOTICE
            && "Alice".equals(b.nick()) && b.text().startsWith("You found a level 1")));
        assertEquals("levelup", store.snapshot().events().get(0).kind());
    }

    @Test
    void highLevelPlayersAlwaysChallengeOnLevelUp() throws GameException {
        store.transact(tx -> {
            Player a = online(tx, "Alice");
            Player b = online(tx, "Bob");
            a.setLevel(ProgressionEngine.HIGH_LEVEL - 1);
            engine.levelUp(tx, a, List.of(a, b));
            return null;
        });

        assertTrue(store.snapshot().events().stream().anyMatch(e -> e.kind().equals("battle")));
    }

    @Test
    void nobodyToFightMeansNoBattle() throws GameException {
        store.transact(tx -> {
            Player a = online(tx, "Alice");
            a.setLevel(40);
            engine.levelUp(tx, a, List.of(a));
            return null;
        });

        assertFalse(store.snapshot().events().stream().anyMatch(e -> e.kind().equals("battle")));
    }

    @Test
    void generatedItemsStayWithinOneAndAHalfTimesTheLevel() {
        GameRandom random = new GameRandom(99);
        for (int i = 0; i < 500; i++) {
            Item item = ProgressionEngine.rollItem(random, 10);
            assertFalse(item.unique());
            assertTrue(item.level() >= 1 && item.level() <= 15, "level " + item.level());
        }
    }

    @Test
    void movementNeverLeavesTheMap() throws GameException {
        store.transact(tx -> {
            Player corner = online(tx, "corner");
            Player far = online(tx, "far");
            corner.moveTo(0, 0);
            far.moveTo(Player.MAP_WIDTH - 1, Player.MAP_HEIGHT - 1);

            engine.move(tx, List.of(corner, far), 1000, (t, mover, occupant) -> { });

            for (Player p : List.of(corner, far)) {
                assertTrue(p.getX() >= 0 && p.getX() < Player.MAP_WIDTH);
                assertTrue(p.getY() >= 0 && p.getY() < Player.MAP_HEIGHT);
            }
            return null;
        });
    }

    @Test
    void crowdedCellsProduceAtMostOneFightPerCell() throws GameException {
        AtomicInteger fights = new AtomicInteger();
        store.transact(tx -> {
            List<Player> crowd = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                Player p = online(tx, "p" + i);
                p.moveTo(250, 250);
                crowd.add(p);
            }

            engine.move(tx, crowd, 1, (t, mover, occupant) -> {
                assertTrue(mover.sharesCellWith(occupant));
                fights.incrementAndGet();
            });
            return null;
        });

        // 50 players over 9 reachable cells
        assertTrue(fights.get() >= 1 && fights.get() <= 9, "fights " + fights.get());
    }

    @Test
    void offlinePlayersDoNotMove() throws GameException {
        store.transact(tx -> {
            Player a = online(tx, "Alice");
            a.moveTo(10, 10);
            tx.setOffline(a);

            engine.move(tx, List.of(a), 50, (t, mover, occupant) -> { });

            assertEquals(10, a.getX());
            assertEquals(10, a.getY());
            return null;
        });
    }
}
