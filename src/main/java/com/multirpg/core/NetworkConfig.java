package com.multirpg.core;

/**
 * One chat network the bot connects to.
 *
 * @param nickservPass sent to NickServ after registration; null to skip
 * @param serverPass   sent as PASS before NICK; null to skip
 */
public record NetworkConfig(
    String name,
    String host,
    int port,
    String channel,
    String nick,
    boolean useSsl,
    String nickservPass,
    String serverPass
) {
    public NetworkConfig {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("network name required");
        if (port < 1 || port > 65535) throw new IllegalArgumentException("network." + name + ".port out of range: " + port);
    }
}
