package com.multirpg.chat;

import com.multirpg.sim.EventEngine;
import com.multirpg.world.Broadcast;
import com.multirpg.world.GameException;
import com.multirpg.world.Player;
import com.multirpg.world.PlayerStore;
import com.multirpg.world.StoreTx;
import com.multirpg.world.UnauthorizedException;
import com.multirpg.world.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import static com.multirpg.sim.TimeFormat.duration;

/**
 * Admin-only commands for one network connection. Each command is one store
 * transaction; the admin check happens inside it, before any argument is
 * looked at, so a rejected invocation changes nothing.
 */
public class AdminCommandHandler {

    private static final Logger LOG = Logger.getLogger(AdminCommandHandler.class.getName());

    public static final Set<String> COMMANDS = Set.of(
        "HOG", "PAUSE", "SILENT", "CLEARQ", "PUSH", "CHPASS", "CHCLASS",
        "CHUSER", "DEL", "DELOLD", "MKADMIN", "DELADMIN");

    private static final long SECONDS_PER_DAY = 86_400;
    /** A negative PUSH adds time; ten years at most. */
    static final long MAX_PUSH_BACK = 3650 * SECONDS_PER_DAY;

    private final String network;
    private final PlayerStore store;
    private final EventEngine events;
    private final BroadcastRouter router;

    public AdminCommandHandler(String network, PlayerStore store, EventEngine events, BroadcastRouter router) {
        this.network = network;
        this.store = store;
        this.events = events;
        this.router = router;
    }

    public boolean handles(String command) {
        return COMMANDS.contains(command);
    }

    /**
     * Run an admin command for {@code sender}. Replies go out as private
     * messages once the transaction is over.
     *
     * @param command upper-case command word
     * @param args    the words after it
     * @throws GameException the reply text for a rejected command
     */
    public void handle(Sender sender, String command, String[] args) throws GameException {
        // Hash before taking the lock; the result is thrown away if the invoker is refused.
        String newHash = command.equals("CHPASS") && args.length >= 2 ? store.hasher().hash(args[1]) : null;

        store.transact(tx -> {
            Player admin = requireAdmin(tx, sender);
            String reply = switch (command) {
                case "HOG" -> hog(tx);
                case "PAUSE" -> pause(tx, admin);
                case "SILENT" -> silent(tx, args);
                case "CLEARQ" -> "Send queue cleared (" + router.clear(network) + " messages dropped).";
                case "PUSH" -> push(tx, sender, args);
                case "CHPASS" -> chpass(tx, args, newHash);
                case "CHCLASS" -> chclass(tx, args);
                case "CHUSER" -> chuser(tx, args);
                case "DEL" -> del(tx, args);
                case "DELOLD" -> delold(tx, args);
                case "MKADMIN" -> setAdmin(tx, args, true);
                case "DELADMIN" -> setAdmin(tx, args, false);
                default -> throw new IllegalArgumentException("not an admin command: " + command);
            };
            if (reply != null) tx.broadcast(Broadcast.reply(network, sender.nick(), reply));
            return null;
        });
    }

    private Player requireAdmin(StoreTx tx, Sender sender) throws UnauthorizedException {
        Player p = tx.findOnline(network, sender.nick());
        if (p == null) throw new UnauthorizedException("You are not logged in.");
        if (!p.isAdmin()) throw new UnauthorizedException("Access denied.");
        return p;
    }

    // ---- World controls ----

    private String hog(StoreTx tx) {
        EventEngine.HogOutcome outcome = events.handOfGod(tx, tx.onlinePlayers());
        return outcome == null ? "Nobody is online." : null;
    }

    private String pause(StoreTx tx, Player admin) {
        boolean paused = !tx.world().isPaused();
        tx.world().setPaused(paused);
        LOG.info("[AdminCommandHandler] " + admin.tag() + (paused ? " paused" : " resumed") + " the game");
        return paused ? "Game PAUSED: tick loop suspended." : "Game RESUMED: tick loop running.";
    }

    private String silent(StoreTx tx, String[] args) throws ValidationException {
        String usage = "Usage: SILENT <0|1|2|3>  (0=all on, 1=no chan, 2=no pm, 3=all off)";
        if (args.length < 1) throw new ValidationException(usage);
        MuteLevel level;
        try {
            level = MuteLevel.of(Integer.parseInt(args[0]));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(usage);
        }
        tx.world().setMuteLevel(level.level());
        router.setMuteLevel(level);
        LOG.info("[AdminCommandHandler] Mute level set to " + level.level());
        return "Silent mode " + level.level() + ": " + level.label() + ".";
    }

    // ---- Player edits ----

    private String push(StoreTx tx, Sender sender, String[] args) throws GameException {
        if (args.length < 2) throw new ValidationException("Usage: PUSH <username> <seconds>");
        long seconds;
        try {
            seconds = Long.parseLong(args[1]);
        } catch (NumberFormatException e) {
            throw new ValidationException("Usage: PUSH <username> <seconds>");
        }
        if (seconds < -MAX_PUSH_BACK) {
            throw new ValidationException("PUSH can add at most " + MAX_PUSH_BACK + " seconds.");
        }
        Player p = tx.requireByName(args[0]);
        long s = Math.min(seconds, p.getTtl());
        p.setTtl(Math.max(0, p.getTtl() - s));
        tx.broadcastAll(sender.nick() + " pushed " + p.tag() + " " + duration(s) + " toward level "
            + (p.getLevel() + 1) + ". Next level in " + duration(p.getTtl()) + ".");
        return "Done.";
    }

    private String chpass(StoreTx tx, String[] args, String newHash) throws GameException {
        if (newHash == null) throw new ValidationException("Usage: CHPASS <username> <password>");
        Player p = tx.requireByName(args[0]);
        p.setPasswordHash(newHash);
        return "Password for " + p.getUsername() + " changed.";
    }

    private String chclass(StoreTx tx, String[] args) throws GameException {
        if (args.length < 2) throw new ValidationException("Usage: CHCLASS <username> <class>");
        String newClass = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
        SessionCoordinator.validateClass(newClass);
        Player p = tx.requireByName(args[0]);
        p.setCharacterClass(newClass);
        return "Class for " + p.getUsername() + " changed to " + newClass + ".";
    }

    private String chuser(StoreTx tx, String[] args) throws GameException {
        if (args.length < 2) throw new ValidationException("Usage: CHUSER <username> <new name>");
        String newName = args[1];
        if (newName.length() > SessionCoordinator.MAX_NAME_LENGTH) {
            throw new ValidationException("New name must be 1-16 characters.");
        }
        if (newName.startsWith("#")) throw new ValidationException("Character names may not begin with #.");
        Player p = tx.requireByName(args[0]);
        String oldName = p.getUsername();
        tx.rename(p, newName);
        return "Username changed from " + oldName + " to " + newName + ".";
    }

    private String del(StoreTx tx, String[] args) throws GameException {
        if (args.length < 1) throw new ValidationException("Usage: DEL <username>");
        Player p = tx.requireByName(args[0]);
        tx.delete(p);
        LOG.info("[AdminCommandHandler] Deleted account " + p.tag());
        return "Account " + p.getUsername() + " removed.";
    }

    /** Offline accounts whose last login is more than {@code days} ago. */
    private String delold(StoreTx tx, String[] args) throws ValidationException {
        String usage = "Usage: DELOLD <days>";
        if (args.length < 1) throw new ValidationException(usage);
        double days;
        try {
            days = Double.parseDouble(args[0]);
        } catch (NumberFormatException e) {
            throw new ValidationException(usage);
        }
        if (days < 0 || Double.isNaN(days) || Double.isInfinite(days)) throw new ValidationException(usage);
        long cutoff = tx.now() - (long) (days * SECONDS_PER_DAY);
        List<Player> stale = new ArrayList<>();
        for (Player p : tx.allPlayers()) {
            if (!p.isOnline() && p.getLastLogin() < cutoff) stale.add(p);
        }
        for (Player p : stale) tx.delete(p);
        LOG.info("[AdminCommandHandler] DELOLD " + args[0] + " removed " + stale.size() + " accounts");
        return stale.size() + " accounts removed.";
    }

    private String setAdmin(StoreTx tx, String[] args, boolean admin) throws GameException {
        String word = admin ? "MKADMIN" : "DELADMIN";
        if (args.length < 1) throw new ValidationException("Usage: " + word + " <username>");
        Player p = tx.requireByName(args[0]);
        p.setAdmin(admin);
        return p.getUsername() + (admin ? " is now an admin." : " is no longer an admin.");
    }
}
