package ai.landlord.sync;

import ai.landlord.config.AiProperties;
import ai.landlord.config.TableProperties;
import ai.landlord.game.GameEngine;
import ai.landlord.game.IllegalActionException;
import ai.landlord.game.RandomSource;
import ai.landlord.game.RejectReason;
import ai.landlord.game.Seat;
import ai.landlord.player.HintService;
import ai.landlord.player.ai.HeuristicPlayer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for connected clients: matchmaking queue, practice tables and routing of table
 * messages to the client's {@link TableRuntime}.
 * <p>
 * Queue changes are serialised on the lobby itself; table state is never touched here, every
 * table message is forwarded to the owning runtime's mailbox.
 */
public class Lobby implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Lobby.class);

    private final GameEngine engine;
    private final TableProperties tableProperties;
    private final ScheduledExecutorService scheduler;
    private final RandomSource random;
    private final HeuristicPlayer ai;
    private final HintService hints;
    private final ProtocolCodec codec;

    private final List<QueueEntry> queue = new ArrayList<>();
    private final Map<String, TableRuntime> tables = new ConcurrentHashMap<>();
    private final Map<String, Membership> memberships = new ConcurrentHashMap<>();
    private final AtomicLong tableCounter = new AtomicLong();

    public Lobby(GameEngine engine, AiProperties aiProperties, TableProperties tableProperties,
            ScheduledExecutorService scheduler, RandomSource random) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.tableProperties = Objects.requireNonNull(tableProperties, "tableProperties");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.random = Objects.requireNonNull(random, "random");
        this.ai = new HeuristicPlayer(aiProperties, random);
        this.hints = new HintService(random);
        this.codec = new ProtocolCodec();
    }

    /**
     * Decodes and handles a raw text frame. Malformed frames are answered with an error.
     */
    public void onMessage(ClientChannel channel, String raw) {
        ClientMessage message;
        try {
            message = codec.decodeClient(raw);
        } catch (IllegalActionException e) {
            sendError(channel, e);
            return;
        }
        onMessage(channel, message);
    }

    public void onMessage(ClientChannel channel, ClientMessage message) {
        try {
            if (message instanceof ClientMessage.Join join) {
                join(channel, join.nickname());
            } else if (message instanceof ClientMessage.Leave) {
                leaveQueue(channel);
            } else if (message instanceof ClientMessage.Practice practice) {
                practice(channel, practice.nickname());
            } else if (message instanceof ClientMessage.Bid bid) {
                Membership m = requireMembership(channel);
                m.runtime().bid(m.seat(), bid.wantsToBid());
            } else if (message instanceof ClientMessage.Play play) {
                Membership m = requireMembership(channel);
                m.runtime().play(m.seat(), play.cardIds());
            } else if (message instanceof ClientMessage.Pass) {
                Membership m = requireMembership(channel);
                m.runtime().pass(m.seat());
            } else if (message instanceof ClientMessage.Hint) {
                Membership m = requireMembership(channel);
                m.runtime().hint(m.seat());
            } else {
                throw new IllegalActionException(RejectReason.MALFORMED_MESSAGE, "Unsupported message");
            }
        } catch (IllegalActionException e) {
            sendError(channel, e);
        }
    }

    /**
     * Handles a closed connection: leaves the queue and aborts an unfinished table.
     */
    public void disconnect(ClientChannel channel) {
        leaveQueue(channel);
        Membership m = memberships.remove(channel.id());
        if (m != null) {
            m.runtime().disconnect(m.seat());
        }
    }

    /**
     * Enters the matchmaking queue; the third queued client starts a table.
     */
    public synchronized void join(ClientChannel channel, String nickname) {
        if (isQueued(channel)) {
            throw new IllegalActionException(RejectReason.WRONG_PHASE, "Already in the matchmaking queue");
        }
        requireNotSeated(channel);
        queue.add(new QueueEntry(channel, displayName(nickname, channel)));
        publishQueue();
        if (queue.size() >= Seat.COUNT) {
            List<TableSeat> seats = new ArrayList<>();
            for (int i = 0; i < Seat.COUNT; i++) {
                QueueEntry entry = queue.remove(0);
                seats.add(TableSeat.remote(Seat.of(i), entry.nickname(), entry.channel()));
            }
            publishQueue();
            createTable(seats);
        }
    }

    public synchronized void leaveQueue(ClientChannel channel) {
        if (queue.removeIf(entry -> entry.channel().id().equals(channel.id()))) {
            publishQueue();
        }
    }

    /**
     * Starts a table with the client in seat 0 and AI opponents in seats 1 and 2.
     */
    public synchronized TableRuntime practice(ClientChannel channel, String nickname) {
        if (isQueued(channel)) {
            throw new IllegalActionException(RejectReason.WRONG_PHASE, "Already in the matchmaking queue");
        }
        requireNotSeated(channel);
        List<TableSeat> seats = List.of(
                TableSeat.remote(Seat.of(0), displayName(nickname, channel), channel),
                TableSeat.ai(Seat.of(1), "Robot 1"),
                TableSeat.ai(Seat.of(2), "Robot 2"));
        return createTable(seats);
    }

    public synchronized int queueSize() {
        return queue.size();
    }

    public Optional<TableRuntime> tableOf(ClientChannel channel) {
        Membership m = memberships.get(channel.id());
        return m == null ? Optional.empty() : Optional.of(m.runtime());
    }

    public int tableCount() {
        return tables.size();
    }

    @Override
    public void close() {
        for (TableRuntime runtime : tables.values()) {
            runtime.close();
        }
        tables.clear();
        memberships.clear();
    }

    private TableRuntime createTable(List<TableSeat> seats) {
        String tableId = "ddz_" + tableCounter.incrementAndGet();
        TableRuntime runtime = new TableRuntime(tableId, seats, engine, ai, hints, tableProperties, scheduler, random,
                this::scheduleCleanup);
        tables.put(tableId, runtime);
        for (TableSeat seat : seats) {
            if (seat.isRemote()) {
                memberships.put(seat.channel().id(), new Membership(runtime, seat.seat()));
            }
        }
        runtime.start();
        return runtime;
    }

    /**
     * Called on the table's mailbox thread when its deal ends. Removal (which closes the
     * mailbox) always runs on the scheduler.
     */
    private void scheduleCleanup(TableRuntime runtime) {
        long delay = tableProperties.getCleanupDelaySeconds();
        scheduler.schedule(() -> removeTable(runtime.tableId()), Math.max(0, delay), TimeUnit.SECONDS);
    }

    private void removeTable(String tableId) {
        TableRuntime runtime = tables.get(tableId);
        if (runtime == null) {
            return;
        }
        memberships.values().removeIf(m -> m.runtime() == runtime);
        tables.remove(tableId);
        runtime.close();
        log.info("Table {} removed", tableId);
    }

    private Membership requireMembership(ClientChannel channel) {
        Membership m = memberships.get(channel.id());
        if (m == null) {
            throw new IllegalActionException(RejectReason.NOT_SEATED);
        }
        return m;
    }

    private void requireNotSeated(ClientChannel channel) {
        Membership m = memberships.get(channel.id());
        if (m == null) {
            return;
        }
        if (!m.runtime().isFinished()) {
            throw new IllegalActionException(RejectReason.WRONG_PHASE, "Already at a table");
        }
        memberships.remove(channel.id());
    }

    private boolean isQueued(ClientChannel channel) {
        for (QueueEntry entry : queue) {
            if (entry.channel().id().equals(channel.id())) {
                return true;
            }
        }
        return false;
    }

    private void publishQueue() {
        for (int i = 0; i < queue.size(); i++) {
            queue.get(i).channel().send(new ServerMessage.Waiting(i + 1, queue.size()));
        }
    }

    private static void sendError(ClientChannel channel, IllegalActionException e) {
        channel.send(new ServerMessage.ErrorMessage(e.reason().name(), e.getMessage()));
    }

    private static String displayName(String nickname, ClientChannel channel) {
        if (nickname == null || nickname.isBlank()) {
            return "Player " + channel.id();
        }
        return nickname.trim();
    }

    private record QueueEntry(ClientChannel channel, String nickname) {
    }

    private record Membership(TableRuntime runtime, Seat seat) {
    }
}
