package com.multirpg.chat;

import java.io.IOException;

/**
 * Outbound side of a network connection. Only a {@link DispatchQueue} calls it.
 */
public interface ChatLink {

    /** Write one message to the wire. */
    void sendLine(OutboundMessage message) throws IOException;
}
