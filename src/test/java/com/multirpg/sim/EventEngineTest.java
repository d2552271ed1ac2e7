package com.multirpg.sim;

import com.multirpg.math.GameRandom;
import com.multirpg.world.DuplicateNameException;
import com.multirpg.world.GameException;
import com.multirpg.world.Item;
import com.multirpg.world.ItemSlot;
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventEngineTest {

    private PlayerStore store;
    private final EventEngine engine = new EventEngine();

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(1_700_000_000L);
        store = new PlayerStore(new WorldState(clock.seconds() + 3600), new GameRandom(2024), clock,
            new PasswordHasher(1000));
    }

    private static Player online(StoreTx tx, String name) throws DuplicateNameException {
        Player p = tx.createPlayer(name, "net1", "hash", "Tester");
        tx.setOnline(p, name, "#rpg", name + "!u@host");
        return p;
    }

    private static List<Player> crowd(StoreTx tx, int n) throws DuplicateNameException {
        List<Player> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(online(tx, "p" + i));
        return out;
    }

    @Test
    void handOfGodNeedsSomeoneOnline() throws GameException {
        store.transact(tx -> {
            assertNull(engine.handOfGod(tx, List.of()));
            Player a = online(tx, "Alice");
            tx.setOffline(a);
            assertNull(engine.handOfGod(tx, List.of(a)));
            return null;
        });
    }

    @Test
    void handOfGodMovesFiveToSeventyFivePercent() throws GameException {
        store.transact(tx -> {
            Player a = online(tx, "Alice");
            for (int i = 0; i < 300; i++) {
                a.setTtl(10_000);
                EventEngine.HogOutcome out = engine.handOfGod(tx, List.of(a));
                assertNotNull(out);
                assertTrue(out.percent() >= 5 && out.percent() <= 75, "percent " + out.percent());
                assertTrue(Math.abs(out.amount() - out.percent() * 100L) <= 1, "amount " + out.amount());
                long expected = out.helped() ? 10_000 - out.amount() : 10_000 + out.amount();
                assertEquals(expected, a.getTtl());
            }
            return null;
        });
    }

    @Test
    void handOfGodHelpsAboutFourTimesInFive() throws GameException {
        int helped = store.transact(tx -> {
            Player a = online(tx, "Alice");
            int n = 0;
            for (int i = 0; i < 5000; i++) {
                a.setTtl(10_000);
                if (engine.handOfGod(tx, List.of(a)).helped()) n++;
            }
            return n;
        });

        double rate = helped / 5000.0;
        assertTrue(rate > 0.77 && rate < 0.83, "help rate " + rate);
    }

    @Test
    void teamBattleNeedsSixPlayers() throws GameException {
        store.transact(tx -> {
            engine.teamBattle(tx, crowd(tx, 5));
            return null;
        });
        assertTrue(store.snapshot().events().isEmpty());

        store.transact(tx -> {
            online(tx, "sixth");
            engine.teamBattle(tx, tx.onlinePlayers());
            return null;
        });
        assertEquals("team_battle", store.snapshot().events().get(0).kind());
    }

    @Test
    void calamityNeverHelpsAndGodsendNeverHurts() throws GameException {
        store.transact(tx -> {
            Player a = online(tx, "Alice");
            for (int i = 0; i < 200; i++) {
                a.setTtl(5000);
                engine.calamity(tx, List.of(a));
                assertTrue(a.getTtl() >= 5000);
                a.setTtl(5000);
                engine.godsend(tx, List.of(a));
                assertTrue(a.getTtl() <= 5000);
            }
            return null;
        });
    }

    @Test
    void goodnessNeedsTwoGoodPlayers() throws GameException {
        store.transact(tx -> {
            Player a = online(tx, "Alice");
            Player b = online(tx, "Bob");
            a.setAlignment(Alignment.GOOD);
            a.setTtl(1000);
            b.setTtl(1000);

            engine.goodness(tx, List.of(a, b));
            assertEquals(1000, a.getTtl());

            b.setAlignment(Alignment.GOOD);
            engine.goodness(tx, List.of(a, b));
            assertTrue(a.getTtl() <= 950 && a.getTtl() >= 880, "ttl " + a.getTtl());
            assertEquals(a.getTtl(), b.getTtl());
            return null;
        });
    }

    @Test
    void scalingAnItemRoundsAndSkipsEmptySlots() throws GameException {
        store.transact(tx -> {
            Player a = online(tx, "Alice");
            a.equip(Item.generated(ItemSlot.RING, 10));
            EventEngine.scaleItem(a, ItemSlot.RING, 0.10);
            assertEquals(11, a.getItemLevel(ItemSlot.RING));
            EventEngine.scaleItem(a, ItemSlot.RING, -0.10);
            assertEquals(10, a.getItemLevel(ItemSlot.RING));

            EventEngine.scaleItem(a, ItemSlot.AMULET, 0.10);
            assertEquals(0, a.getItemLevel(ItemSlot.AMULET));
            return null;
        });
    }

    @Test
    void dailyOddsScaleWithPlayersAndInterval() {
        assertEquals(5.0 / (20 * 86400), EventEngine.odds(1, 20, 5), 1e-15);
        assertEquals(0.0, EventEngine.odds(0, 8, 5));
        assertEquals(2 * EventEngine.odds(1, 4, 5), EventEngine.odds(2, 4, 5), 1e-15);
    }
}
