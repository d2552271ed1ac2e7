package com.multirpg.chat;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link ChatLink} that keeps everything it is asked to send. */
public class RecordingLink implements ChatLink {

    private final List<OutboundMessage> sent = new ArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger(0);

    public void failNext(int sends) { failuresLeft.set(sends); }

    @Override
    public synchronized void sendLine(OutboundMessage message) throws IOException {
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) throw new IOException("link down");
        sent.add(message);
    }

    public synchronized List<OutboundMessage> sent() { return new ArrayList<>(sent); }

    public synchronized List<String> texts() {
        List<String> out = new ArrayList<>();
        for (OutboundMessage m : sent) out.add(m.text());
        return out;
    }

    public synchronized void reset() { sent.clear(); }
}
