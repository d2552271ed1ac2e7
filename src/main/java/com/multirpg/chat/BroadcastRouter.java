package com.multirpg.chat;

import com.multirpg.world.Broadcast;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Turns {@link Broadcast}s into queued messages on the right connections and
 * asks those connections to flush. Never called with the player table locked.
 */
public class BroadcastRouter {

    private static final Logger LOG = Logger.getLogger(BroadcastRouter.class.getName());

    private record Endpoint(String channel, DispatchQueue queue) { }

    private final Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();

    public void register(String network, String channel, DispatchQueue queue) {
        endpoints.put(network, new Endpoint(channel, queue));
    }

    public DispatchQueue queue(String network) {
        Endpoint e = endpoints.get(network);
        return e != null ? e.queue() : null;
    }

    /** Queue every broadcast and flush the queues that received something. */
    public void route(List<Broadcast> broadcasts) {
        Map<String, DispatchQueue> touched = new LinkedHashMap<>();
        for (Broadcast b : broadcasts) {
            switch (b.scope()) {
                case ALL -> {
                    for (var entry : endpoints.entrySet()) {
                        Endpoint e = entry.getValue();
                        e.queue().enqueue(e.channel(), b.text(), OutboundMessage.Kind.CHANNEL);
                        touched.put(entry.getKey(), e.queue());
                    }
                }
                case NETWORK -> enqueue(touched, b.network(), null, b.text(), OutboundMessage.Kind.CHANNEL);
                case NOTICE -> enqueue(touched, b.network(), b.nick(), b.text(), OutboundMessage.Kind.NOTICE);
                case PRIVATE -> enqueue(touched, b.network(), b.nick(), b.text(), OutboundMessage.Kind.PRIVATE);
            }
        }
        touched.values().forEach(DispatchQueue::requestFlush);
    }

    private void enqueue(Map<String, DispatchQueue> touched, String network, String nick,
                         String text, OutboundMessage.Kind kind) {
        Endpoint e = endpoints.get(network);
        if (e == null) {
            LOG.warning("[BroadcastRouter] No connection for network " + network + ", message dropped");
            return;
        }
        e.queue().enqueue(nick != null ? nick : e.channel(), text, kind);
        touched.put(network, e.queue());
    }

    /** Ask every connection to deliver what it has queued. */
    public void flushAll() {
        for (Endpoint e : endpoints.values()) e.queue().requestFlush();
    }

    /** Apply a mute level to every connection. */
    public void setMuteLevel(MuteLevel level) {
        for (Endpoint e : endpoints.values()) e.queue().setMuteLevel(level);
    }

    /** Clear one connection's queue; 0 when the network is unknown. */
    public int clear(String network) {
        DispatchQueue q = queue(network);
        return q != null ? q.clear() : 0;
    }

    public void shutdown() {
        for (Endpoint e : endpoints.values()) e.queue().shutdown();
    }
}
