package com.multirpg.chat;

import com.multirpg.core.NetworkConfig;

import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client connection to one chat network.
 * <p>
 * A reader thread connects, registers, joins the configured channel and turns
 * incoming lines into {@link InboundEvents} calls. After each join it lists the
 * channel with WHO so suspended sessions can resume. When the socket drops it
 * reports the loss and connects again after a delay. Writes come from the network's
 * {@link DispatchQueue} through {@link #sendLine}.
 */
public class IrcConnection implements ChatLink {

    private static final Logger LOG = Logger.getLogger(IrcConnection.class.getName());

    public static final long RECONNECT_DELAY_MS = 30_000;

    private final NetworkConfig config;
    private final long reconnectDelayMs;
    private volatile InboundEvents events;

    private final Object writeLock = new Object();
    private volatile Socket socket;
    private BufferedWriter writer;     // guarded by writeLock
    private volatile String currentNick;

    private volatile boolean running;
    private volatile boolean inChannel;
    private Thread readerThread;

    public IrcConnection(NetworkConfig config, InboundEvents events) {
        this(config, events, RECONNECT_DELAY_MS);
    }

    public IrcConnection(NetworkConfig config, InboundEvents events, long reconnectDelayMs) {
        this.config = config;
        this.events = events;
        this.reconnectDelayMs = reconnectDelayMs;
        this.currentNick = config.nick();
    }

    public void setEvents(InboundEvents events) { this.events = events; }

    public String getName() { return config.name(); }

    public String getCurrentNick() { return currentNick; }

    public boolean isConnected() {
        Socket s = socket;
        return s != null && s.isConnected() && !s.isClosed();
    }

    // ---- Lifecycle ----

    public synchronized void start() {
        if (running) return;
        running = true;
        readerThread = new Thread(this::runLoop, "Irc-" + config.name());
        readerThread.setDaemon(true);
        readerThread.start();
    }

    public synchronized void stop() {
        running = false;
        try {
            writeRaw("QUIT :Shutting down");
        } catch (IOException e) {
            LOG.fine(() -> "[IrcConnection] " + config.name() + ": QUIT not sent: " + e.getMessage());
        }
        closeSocket();
        if (readerThread != null) readerThread.interrupt();
    }

    private void runLoop() {
        while (running) {
            try {
                connect();
                readLoop();
            } catch (IOException e) {
                if (running) LOG.warning("[IrcConnection] " + config.name() + ": connection lost: " + e.getMessage());
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "[IrcConnection] " + config.name() + ": unexpected error", e);
            } finally {
                closeSocket();
                leftChannel();
            }
            if (!running) break;
            LOG.info("[IrcConnection] " + config.name() + ": reconnecting in " + reconnectDelayMs / 1000 + "s");
            try {
                TimeUnit.MILLISECONDS.sleep(reconnectDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOG.info("[IrcConnection] " + config.name() + ": reader stopped");
    }

    /**
     * Tell the coordinator once per lost channel, not once per failed connect.
     * A deliberate stop keeps the sessions so a restart can resume them.
     */
    private void leftChannel() {
        if (!inChannel) return;
        inChannel = false;
        if (running) events.disconnected();
    }

    private void connect() throws IOException {
        LOG.info("[IrcConnection] " + config.name() + ": connecting to " + config.host() + ":" + config.port()
            + (config.useSsl() ? " (TLS)" : ""));
        SocketFactory factory = config.useSsl() ? SSLSocketFactory.getDefault() : SocketFactory.getDefault();
        Socket s = factory.createSocket(config.host(), config.port());
        synchronized (writeLock) {
            socket = s;
            writer = new BufferedWriter(new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8));
        }
        currentNick = config.nick();
        if (config.serverPass() != null) writeRaw("PASS " + config.serverPass());
        writeRaw("NICK " + currentNick);
        writeRaw("USER multirpg 0 * :Multi IdleRPG Bot");
    }

    private void readLoop() throws IOException {
        Socket s = socket;
        BufferedReader reader = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
        String line;
        while (running && (line = reader.readLine()) != null) {
            handleLine(line);
        }
    }

    private void closeSocket() {
        synchronized (writeLock) {
            Socket s = socket;
            socket = null;
            writer = null;
            if (s != null) {
                try {
                    s.close();
                } catch (IOException e) {
                    LOG.fine(() -> "[IrcConnection] " + config.name() + ": close failed: " + e.getMessage());
                }
            }
        }
    }

    // ---- Outbound ----

    @Override
    public void sendLine(OutboundMessage message) throws IOException {
        writeRaw(message.toLine());
    }

    void writeRaw(String line) throws IOException {
        synchronized (writeLock) {
            if (writer == null) throw new IOException("not connected to " + config.name());
            writer.write(line);
            writer.write("\r\n");
            writer.flush();
        }
    }

    // ---- Inbound ----

    /** Handle one raw line from the server. */
    void handleLine(String raw) throws IOException {
        IrcLine line = IrcLine.parse(raw);
        if (line == null) return;

        switch (line.command()) {
            case "PING" -> writeRaw(line.params().isEmpty() ? "PONG" : "PONG :" + line.last());
            case "001" -> onRegistered();
            case "433" -> {
                currentNick = currentNick + "_";
                writeRaw("NICK " + currentNick);
            }
            // <me> <channel> <user> <host> <server> <nick> <flags> :<hops> <realname>
            case "352" -> {
                if (line.params().size() < 6 || !line.param(1).equalsIgnoreCase(config.channel())) return;
                String nick = line.param(5);
                if (nick.equalsIgnoreCase(currentNick)) return;
                events.channelMember(new Sender(nick, nick + "!" + line.param(2) + "@" + line.param(3)));
            }
            case "315" -> {
                if (line.params().size() > 1 && line.param(1).equalsIgnoreCase(config.channel())) {
                    events.channelListEnd();
                }
            }
            default -> {
                if (line.prefix() != null) dispatch(line);
            }
        }
    }

    private void onRegistered() throws IOException {
        LOG.info("[IrcConnection] " + config.name() + ": registered as " + currentNick + ", joining " + config.channel());
        if (config.nickservPass() != null) writeRaw("PRIVMSG NickServ :IDENTIFY " + config.nickservPass());
        writeRaw("MODE " + currentNick + " +i");
        writeRaw("JOIN " + config.channel());
    }

    private void dispatch(IrcLine line) throws IOException {
        String from = line.nick();
        boolean self = from.equalsIgnoreCase(currentNick);
        switch (line.command()) {
            case "JOIN" -> {
                if (self) {
                    inChannel = true;
                    events.join();
                    writeRaw("WHO " + config.channel());
                }
            }
            case "NICK" -> {
                if (self) {
                    currentNick = line.param(0);
                } else {
                    events.nickChanged(from, line.param(0));
                }
            }
            case "PRIVMSG" -> {
                if (self) return;
                String target = line.param(0);
                if (target.equalsIgnoreCase(currentNick)) {
                    events.privateMessage(line.sender(), line.last());
                } else if (target.equalsIgnoreCase(config.channel())) {
                    events.channelMessage(line.sender(), line.last());
                }
            }
            case "NOTICE" -> {
                if (!self && line.param(0).equalsIgnoreCase(config.channel())) {
                    events.channelMessage(line.sender(), line.last());
                }
            }
            case "PART" -> {
                if (!self && line.param(0).equalsIgnoreCase(config.channel())) events.parted(line.sender());
            }
            case "QUIT" -> {
                if (!self) events.quit(line.sender());
            }
            case "KICK" -> {
                String target = line.param(1);
                if (!line.param(0).equalsIgnoreCase(config.channel())) return;
                if (target.equalsIgnoreCase(currentNick)) {
                    LOG.warning("[IrcConnection] " + config.name() + ": kicked from " + config.channel() + ", rejoining");
                    writeRaw("JOIN " + config.channel());
                } else {
                    events.kicked(target);
                }
            }
            default -> { }
        }
    }
}
