package com.multirpg.chat;

/**
 * What a network connection reports. One implementation per connection; calls
 * from one connection arrive on that connection's reader thread.
 */
public interface InboundEvents {

    /**
     * The bot joined its channel. Everyone still marked online on this network
     * is suspended; the connection then lists the channel's members.
     */
    void join();

    /** The connection dropped. */
    void disconnected();

    /** One member of the channel listing that follows {@link #join()}. */
    void channelMember(Sender member);

    /** End of the channel listing. */
    void channelListEnd();

    void privateMessage(Sender sender, String text);

    void channelMessage(Sender sender, String text);

    void nickChanged(String oldNick, String newNick);

    void parted(Sender sender);

    void quit(Sender sender);

    void kicked(String targetNick);
}
