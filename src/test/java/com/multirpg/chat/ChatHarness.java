package com.multirpg.chat;

import com.multirpg.math.GameRandom;
import com.multirpg.sim.EventEngine;
import com.multirpg.sim.PenaltyCalculator;
import com.multirpg.sim.QuestEngine;
import com.multirpg.world.MutableClock;
import com.multirpg.world.PasswordHasher;
import com.multirpg.world.PlayerStore;
import com.multirpg.world.PlayerView;
import com.multirpg.world.WorldState;

import java.util.ArrayList;
import java.util.List;

/**
 * One network wired the way the server wires it, with a recording link in
 * place of the IRC connection. {@link #flush()} drains the queue on the
 * calling thread.
 */
class ChatHarness implements AutoCloseable {

    static final String NETWORK = "net1";
    static final String CHANNEL = "#rpg";

    final MutableClock clock = new MutableClock(1_700_000_000L);
    final PlayerStore store;
    final BroadcastRouter router = new BroadcastRouter();
    final RecordingLink link = new RecordingLink();
    final DispatchQueue queue = new DispatchQueue(NETWORK, link, 0, 2000);
    final SessionCoordinator session;

    private final List<OutboundMessage> delivered = new ArrayList<>();

    ChatHarness(String... configuredAdmins) {
        store = new PlayerStore(new WorldState(clock.seconds() + 3600), new GameRandom(11), clock,
            new PasswordHasher(1000));
        store.setConfiguredAdmins(List.of(configuredAdmins));
        store.setBroadcastSink(router::route);
        router.register(NETWORK, CHANNEL, queue);
        PenaltyCalculator penalties = new PenaltyCalculator(0);
        AdminCommandHandler admin = new AdminCommandHandler(NETWORK, store, new EventEngine(), router);
        session = new SessionCoordinator(NETWORK, CHANNEL, store, penalties, new QuestEngine(penalties),
            admin, router);
    }

    void pm(String nick, String text) {
        session.privateMessage(Sender.of(nick), text);
    }

    /** Everything delivered since the last call. */
    List<OutboundMessage> flush() {
        queue.flushDeliver();
        List<OutboundMessage> all = link.sent();
        List<OutboundMessage> fresh = new ArrayList<>(all.subList(delivered.size(), all.size()));
        delivered.addAll(fresh);
        return fresh;
    }

    /** Private replies to {@code nick} since the last flush. */
    List<String> replies(String nick) {
        return texts(flush(), nick, OutboundMessage.Kind.PRIVATE);
    }

    static List<String> texts(List<OutboundMessage> messages, String destination, OutboundMessage.Kind kind) {
        List<String> out = new ArrayList<>();
        for (OutboundMessage m : messages) {
            if (m.kind() == kind && m.destination().equals(destination)) out.add(m.text());
        }
        return out;
    }

    /** Register and log in {@code name} from the nick of the same name, discarding the output. */
    void register(String name) {
        pm(name, "REGISTER " + name + " pw Tester");
        flush();
    }

    PlayerView player(String name) {
        for (PlayerView v : store.snapshot().players()) {
            if (v.username().equalsIgnoreCase(name)) return v;
        }
        return null;
    }

    @Override
    public void close() {
        router.shutdown();
    }
}
