package com.multirpg.chat;

import com.multirpg.sim.Alignment;
import com.multirpg.sim.PenaltyCalculator;
import com.multirpg.sim.PenaltyKind;
import com.multirpg.sim.QuestEngine;
import com.multirpg.world.Broadcast;
import com.multirpg.world.GameException;
import com.multirpg.world.NotFoundException;
import com.multirpg.world.Player;
import com.multirpg.world.PlayerStore;
import com.multirpg.world.PlayerView;
import com.multirpg.world.StoreTx;
import com.multirpg.world.UnauthorizedException;
import com.multirpg.world.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

import static com.multirpg.sim.TimeFormat.duration;

/**
 * Turns one network connection's inbound events into store transactions.
 * <p>
 * Private messages are commands. Channel talk, nick changes, parts, quits and
 * kicks cost the player time; every such penalty on a quester also fails the
 * running quest. A {@link GameException} from a command becomes exactly one
 * private reply and nothing else.
 */
public class SessionCoordinator implements InboundEvents {

    private static final Logger LOG = Logger.getLogger(SessionCoordinator.class.getName());

    public static final int MAX_NAME_LENGTH = 16;
    public static final int MAX_CLASS_LENGTH = 30;
    static final int TOP_COUNT = 5;

    private static final List<String> HELP = List.of(
        "MultiRPG commands (all via PM to the bot):",
        "  REGISTER <username> <password> <class>  - Create account",
        "  LOGIN <username> <password>              - Log in",
        "  LOGOUT                                   - Log out (penalty!)",
        "  STATUS [username]                        - Show stats",
        "  WHOAMI                                   - Short status",
        "  QUEST                                    - Active quest info",
        "  TOP                                      - Top 5 players",
        "  NEWPASS <password>                       - Change password",
        "  ALIGN <good|neutral|evil>                - Change alignment",
        "  REMOVEME                                 - Delete account",
        "Talking in channel, parting, quitting, nick changes = penalty!",
        "Admin commands: HOG PUSH CHPASS CHCLASS CHUSER DEL PAUSE SILENT CLEARQ DELOLD MKADMIN DELADMIN");

    private final String network;
    private final String channel;
    private final PlayerStore store;
    private final PenaltyCalculator penalties;
    private final QuestEngine quests;
    private final AdminCommandHandler admin;
    private final BroadcastRouter router;

    public SessionCoordinator(String network, String channel, PlayerStore store, PenaltyCalculator penalties,
                              QuestEngine quests, AdminCommandHandler admin, BroadcastRouter router) {
        this.network = network;
        this.channel = channel;
        this.store = store;
        this.penalties = penalties;
        this.quests = quests;
        this.admin = admin;
        this.router = router;
    }

    public String getNetwork() { return network; }

    // ---- Connection events ----

    @Override
    public void join() {
        int suspended = suspendSessions();
        LOG.info("[SessionCoordinator] " + network + ": joined " + channel + ", "
            + suspended + " sessions waiting for the member list");
    }

    @Override
    public void disconnected() {
        int suspended = suspendSessions();
        if (suspended > 0) {
            LOG.info("[SessionCoordinator] " + network + ": link lost, " + suspended + " players offline");
        }
    }

    /** Take every online player of this network offline, keeping the address for a resume. */
    private int suspendSessions() {
        int[] count = {0};
        store.mutate(tx -> {
            for (Player p : tx.onlinePlayers(network)) {
                tx.suspend(p);
                count[0]++;
            }
        });
        return count[0];
    }

    /**
     * Resume the first suspended player whose saved address has the member's
     * {@code user@host}, under the member's current nick.
     */
    @Override
    public void channelMember(Sender member) {
        String address = userAtHost(member.userhost());
        if (address == null) return;
        store.mutate(tx -> {
            if (tx.findOnline(network, member.nick()) != null) return;
            for (Player p : tx.resumablePlayers(network)) {
                if (address.equals(userAtHost(p.getUserhost()))) {
                    tx.setOnline(p, member.nick(), channel, member.userhost());
                    LOG.info("[SessionCoordinator] Auto-login: " + p.tag() + " (" + member.userhost() + ")");
                    return;
                }
            }
        });
    }

    @Override
    public void channelListEnd() {
        store.mutate(tx -> {
            for (Player p : tx.resumablePlayers(network)) {
                tx.forgetSession(p);
                LOG.info("[SessionCoordinator] " + p.tag() + " not in channel, logged out");
            }
            int n = tx.onlinePlayers(network).size();
            if (n > 0) {
                tx.broadcast(Broadcast.network(network, n + " user" + (n == 1 ? "" : "s")
                    + " automatically logged in on " + network + "."));
            }
        });
    }

    /** The {@code user@host} part of {@code nick!user@host}, or null without one. */
    static String userAtHost(String userhost) {
        if (userhost == null) return null;
        int bang = userhost.indexOf('!');
        if (bang < 0 || userhost.indexOf('@', bang) < 0) return null;
        return userhost.substring(bang + 1);
    }

    @Override
    public void channelMessage(Sender sender, String text) {
        store.mutate(tx -> {
            Player p = tx.findOnline(network, sender.nick());
            if (p == null) return;
            long pen = penalize(p, PenaltyKind.MESSAGE, text.length());
            tx.broadcast(Broadcast.notice(network, sender.nick(), penaltyNotice(pen, PenaltyKind.MESSAGE)));
            quests.wrath(tx, p);
        });
    }

    @Override
    public void nickChanged(String oldNick, String newNick) {
        store.mutate(tx -> {
            Player p = tx.findOnline(network, oldNick);
            if (p == null) return;
            long pen = penalize(p, PenaltyKind.NICK, 0);
            p.setCurrentNick(newNick);
            tx.broadcast(Broadcast.notice(network, newNick, penaltyNotice(pen, PenaltyKind.NICK)));
            quests.wrath(tx, p);
        });
    }

    @Override
    public void parted(Sender sender) {
        store.mutate(tx -> {
            Player p = tx.findOnline(network, sender.nick());
            if (p == null) return;
            long pen = penalize(p, PenaltyKind.PART, 0);
            tx.setOffline(p);
            tx.broadcast(Broadcast.network(network, p.tag() + " has parted. Penalty: " + duration(pen) + "."));
            quests.wrath(tx, p);
        });
    }

    @Override
    public void quit(Sender sender) {
        store.mutate(tx -> {
            Player p = tx.findOnline(network, sender.nick());
            if (p == null) return;
            penalize(p, PenaltyKind.QUIT, 0);
            tx.setOffline(p);
            quests.wrath(tx, p);
        });
    }

    @Override
    public void kicked(String targetNick) {
        store.mutate(tx -> {
            Player p = tx.findOnline(network, targetNick);
            if (p == null) return;
            long pen = penalize(p, PenaltyKind.KICK, 0);
            tx.setOffline(p);
            tx.broadcast(Broadcast.network(network, p.tag() + " was kicked! Penalty: " + duration(pen) + "."));
            quests.wrath(tx, p);
        });
    }

    private long penalize(Player p, PenaltyKind kind, int messageLength) {
        long pen = penalties.penalty(kind, p.getLevel(), messageLength);
        p.addPenalty(kind, pen);
        LOG.fine(() -> "[SessionCoordinator] " + p.tag() + " penalized " + pen + "s for " + kind.reason());
        return pen;
    }

    private static String penaltyNotice(long pen, PenaltyKind kind) {
        return "Penalty of " + duration(pen) + " added to your timer for " + kind.reason() + ".";
    }

    // ---- Commands ----

    @Override
    public void privateMessage(Sender sender, String text) {
        String[] words = text.strip().split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) return;
        String command = words[0].toUpperCase(Locale.ROOT);
        String[] args = Arrays.copyOfRange(words, 1, words.length);
        try {
            dispatch(sender, command, args);
        } catch (GameException e) {
            reply(sender, e.getMessage());
        }
    }

    private void dispatch(Sender sender, String command, String[] args) throws GameException {
        switch (command) {
            case "REGISTER" -> register(sender, args);
            case "LOGIN" -> login(sender, args);
            case "HELP" -> help(sender);
            case "LOGOUT" -> logout(sender);
            case "NEWPASS" -> newpass(sender, args);
            case "ALIGN" -> align(sender, args);
            case "REMOVEME" -> removeme(sender);
            case "WHOAMI" -> whoami(sender);
            case "STATUS" -> status(sender, args);
            case "QUEST" -> withSelf(sender, (tx, p) -> tx.broadcast(reply(sender.nick(), quests.describe(tx))));
            case "TOP" -> top(sender);
            default -> {
                if (admin.handles(command)) {
                    admin.handle(sender, command, args);
                } else {
                    throw new ValidationException("Unknown command '" + command + "'. Send HELP for a list of commands.");
                }
            }
        }
    }

    /** Send one private reply outside any transaction. */
    private void reply(Sender sender, String text) {
        router.route(List.of(Broadcast.reply(network, sender.nick(), text)));
    }

    private void help(Sender sender) {
        List<Broadcast> lines = new ArrayList<>(HELP.size());
        for (String line : HELP) lines.add(reply(sender.nick(), line));
        router.route(lines);
    }

    private Broadcast reply(String nick, String text) {
        return Broadcast.reply(network, nick, text);
    }

    private void register(Sender sender, String[] args) throws GameException {
        if (args.length < 3) throw new ValidationException("Usage: REGISTER <username> <password> <class>");
        String username = args[0];
        String characterClass = String.join(" ", Arrays.copyOfRange(args, 2, args.length));
        validateName(username);
        validateClass(characterClass);
        String hash = store.hasher().hash(args[1]);

        store.transact(tx -> {
            if (tx.findOnline(network, sender.nick()) != null) {
                throw new ValidationException("You are already logged in.");
            }
            Player p = tx.createPlayer(username, network, hash, characterClass);
            tx.setOnline(p, sender.nick(), channel, sender.userhost());
            String next = duration(p.getTtl());
            tx.broadcast(reply(sender.nick(), "Success! Account " + username + " created. You have " + next
                + " until level 1. NOTE: The point of the game is to idle. Talking, parting, "
                + "quitting, and nick changes all penalize you!"));
            tx.broadcastAll("Welcome " + sender.nick() + "@" + network + "'s new player " + username
                + ", the " + characterClass + "! Next level in " + next + ".");
            LOG.info("[SessionCoordinator] Registered " + p.tag());
            return null;
        });
    }

    private void login(Sender sender, String[] args) throws GameException {
        if (args.length < 2) throw new ValidationException("Usage: LOGIN <username> <password>");
        PlayerView account = store.authenticate(args[0], args[1]);

        store.transact(tx -> {
            Player p = tx.require(account.id());
            if (p.isOnline() || tx.findOnline(network, sender.nick()) != null) {
                throw new ValidationException("You are already logged in.");
            }
            tx.setOnline(p, sender.nick(), channel, sender.userhost());
            if (!p.isAdmin() && tx.isConfiguredAdmin(p.getUsername())) p.setAdmin(true);
            tx.broadcast(reply(sender.nick(), "Logon successful. " + p.getUsername() + ", the level "
                + p.getLevel() + " " + p.getCharacterClass() + ". Next level in " + duration(p.getTtl()) + "."));
            LOG.info("[SessionCoordinator] " + p.tag() + " logged in as " + sender.nick());
            return null;
        });
    }

    private void logout(Sender sender) throws GameException {
        withSelf(sender, (tx, p) -> {
            long pen = penalize(p, PenaltyKind.LOGOUT, 0);
            tx.setOffline(p);
            tx.broadcast(Broadcast.notice(network, sender.nick(), penaltyNotice(pen, PenaltyKind.LOGOUT)));
            quests.wrath(tx, p);
        });
    }

    private void newpass(Sender sender, String[] args) throws GameException {
        if (args.length < 1) throw new ValidationException("Usage: NEWPASS <password>");
        String hash = store.hasher().hash(args[0]);
        withSelf(sender, (tx, p) -> {
            p.setPasswordHash(hash);
            tx.broadcast(reply(sender.nick(), "Password changed."));
        });
    }

    private void align(Sender sender, String[] args) throws GameException {
        Alignment alignment = args.length > 0 ? Alignment.fromWord(args[0]) : null;
        if (alignment == null) throw new ValidationException("Usage: ALIGN <good|neutral|evil>");
        withSelf(sender, (tx, p) -> {
            p.setAlignment(alignment);
            tx.broadcast(reply(sender.nick(), "Your alignment is now " + alignment.label() + "."));
            tx.broadcastAll(p.tag() + " changed alignment to: " + alignment.label() + ".");
        });
    }

    private void removeme(Sender sender) throws GameException {
        withSelf(sender, (tx, p) -> {
            tx.delete(p);
            tx.broadcast(reply(sender.nick(), "Account " + p.getUsername() + " removed."));
            tx.broadcastAll(sender.nick() + " removed their account, " + p.tag() + ", the "
                + p.getCharacterClass() + ".");
            LOG.info("[SessionCoordinator] " + p.tag() + " removed their account");
        });
    }

    private void whoami(Sender sender) throws GameException {
        withSelf(sender, (tx, p) -> tx.broadcast(reply(sender.nick(), "You are " + p.getUsername()
            + ", the level " + p.getLevel() + " " + p.getCharacterClass() + ". Next level in "
            + duration(p.getTtl()) + ".")));
    }

    private void status(Sender sender, String[] args) throws GameException {
        withSelf(sender, (tx, self) -> {
            Player p = self;
            if (args.length > 0) {
                p = tx.findByName(args[0]);
                if (p == null) throw new NotFoundException("No such user.");
            }
            tx.broadcast(reply(sender.nick(), p.tag() + " | Level " + p.getLevel() + " " + p.getCharacterClass()
                + " (" + p.getAlignment().label() + ") | " + (p.isOnline() ? "Online" : "Offline")
                + " | TTL: " + duration(p.getTtl()) + " | Pos: [" + p.getX() + "/" + p.getY() + "]"
                + " | Items: " + p.itemSum()));
        });
    }

    private void top(Sender sender) throws GameException {
        withSelf(sender, (tx, self) -> {
            List<Player> ranked = tx.ranked();
            if (ranked.isEmpty()) {
                tx.broadcast(reply(sender.nick(), "No players yet."));
                return;
            }
            List<Broadcast> lines = new ArrayList<>();
            for (int i = 0; i < Math.min(TOP_COUNT, ranked.size()); i++) {
                Player p = ranked.get(i);
                lines.add(reply(sender.nick(), (i + 1) + ". " + p.tag() + " - Lv." + p.getLevel() + " "
                    + p.getCharacterClass() + " | Items: " + p.itemSum() + " | TTL: " + duration(p.getTtl())));
            }
            lines.forEach(tx::broadcast);
        });
    }

    /** A command body for the sender's own logged-in player. */
    @FunctionalInterface
    private interface SelfCommand {
        void run(StoreTx tx, Player self) throws GameException;
    }

    /**
     * Run {@code body} for the player logged in as the sender's nick on this
     * network. Fails with "You are not logged in." before touching anything.
     */
    private void withSelf(Sender sender, SelfCommand body) throws GameException {
        store.transact(tx -> {
            Player p = tx.findOnline(network, sender.nick());
            if (p == null) throw new UnauthorizedException("You are not logged in.");
            body.run(tx, p);
            return null;
        });
    }

    // ---- Validation ----

    static void validateName(String username) throws ValidationException {
        if (username.isEmpty() || username.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Character names must be 1-16 chars.");
        }
        if (username.startsWith("#")) throw new ValidationException("Character names may not begin with #.");
    }

    static void validateClass(String characterClass) throws ValidationException {
        if (characterClass.length() > MAX_CLASS_LENGTH) {
            throw new ValidationException("Character classes must be < 31 chars.");
        }
    }
}
