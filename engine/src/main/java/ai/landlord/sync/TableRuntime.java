package ai.landlord.sync;

import ai.landlord.DealLogger;
import ai.landlord.config.TableProperties;
import ai.landlord.game.Action;
import ai.landlord.game.Card;
import ai.landlord.game.GameEngine;
import ai.landlord.game.IllegalActionException;
import ai.landlord.game.Phase;
import ai.landlord.game.RandomSource;
import ai.landlord.game.RejectReason;
import ai.landlord.game.Seat;
import ai.landlord.game.TableState;
import ai.landlord.game.Transition;
import ai.landlord.player.HintService;
import ai.landlord.player.ai.HeuristicPlayer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server-side owner of one table.
 * <p>
 * All reads and writes of the table state happen on a single-thread mailbox: remote messages,
 * AI decisions, turn timeouts and disconnects are queued there and applied one at a time
 * through {@link GameEngine}, then replicated by {@link TableBroadcaster}. Timers run on the
 * shared scheduler and only ever enqueue work; each carries the turn version it was armed for
 * and is ignored once the turn has moved on.
 */
public final class TableRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TableRuntime.class);

    private final String tableId;
    private final List<TableSeat> seats;
    private final GameEngine engine;
    private final HeuristicPlayer ai;
    private final HintService hints;
    private final TableProperties properties;
    private final ScheduledExecutorService scheduler;
    private final RandomSource random;
    private final Consumer<TableRuntime> onFinished;
    private final TableBroadcaster broadcaster;
    private final ExecutorService mailbox;

    // Mailbox-confined.
    private TableState state;
    private long turnVersion;
    private volatile ScheduledFuture<?> pendingTurn;
    private int steps;
    private long startNanos;

    private volatile boolean finished;

    public TableRuntime(String tableId, List<TableSeat> seats, GameEngine engine, HeuristicPlayer ai,
            HintService hints, TableProperties properties, ScheduledExecutorService scheduler, RandomSource random,
            Consumer<TableRuntime> onFinished) {
        this.tableId = Objects.requireNonNull(tableId, "tableId");
        if (seats.size() != Seat.COUNT) {
            throw new IllegalArgumentException("A table needs " + Seat.COUNT + " seats");
        }
        this.seats = List.copyOf(seats);
        this.engine = Objects.requireNonNull(engine, "engine");
        this.ai = Objects.requireNonNull(ai, "ai");
        this.hints = Objects.requireNonNull(hints, "hints");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.random = Objects.requireNonNull(random, "random");
        this.onFinished = onFinished == null ? runtime -> { } : onFinished;
        this.broadcaster = new TableBroadcaster(tableId, this.seats);
        this.mailbox = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "landlord-table-" + tableId);
            t.setDaemon(true);
            return t;
        });
    }

    public String tableId() {
        return tableId;
    }

    /**
     * {@code true} once the deal has finished or been aborted.
     */
    public boolean isFinished() {
        return finished;
    }

    /**
     * Deals the cards, sends {@code game_start} to every remote seat and starts the first turn.
     */
    public CompletionStage<Void> start() {
        return onMailbox(null, () -> {
            startNanos = System.nanoTime();
            state = engine.newDeal(Seat.of(0));
            log.info("Table {} created: {}", tableId, describeSeats());
            guarded("game start", () -> broadcaster.gameStarted(state));
            scheduleTurn();
        });
    }

    public CompletionStage<Void> bid(Seat seat, boolean wantsToBid) {
        return submit(seat, () -> new Action.Bid(seat, wantsToBid));
    }

    /**
     * Plays cards identified by their wire ids. Unknown or duplicated ids are rejected as
     * {@link RejectReason#CARDS_NOT_HELD}.
     */
    public CompletionStage<Void> play(Seat seat, List<String> cardIds) {
        return submit(seat, () -> new Action.Play(seat, resolve(cardIds)));
    }

    public CompletionStage<Void> pass(Seat seat) {
        return submit(seat, () -> new Action.Pass(seat));
    }

    /**
     * Sends a suggested play to the requesting seat only.
     */
    public CompletionStage<Void> hint(Seat seat) {
        return onMailbox(seat, () -> {
            try {
                requireStarted();
                if (state.phase() != Phase.PLAYING) {
                    throw new IllegalActionException(RejectReason.WRONG_PHASE);
                }
                if (!state.currentSeat().equals(seat)) {
                    throw new IllegalActionException(RejectReason.NOT_YOUR_TURN);
                }
                List<Card> suggestion = hints.hint(state.hand(seat), state.lastPlay());
                broadcaster.sendTo(seat, new ServerMessage.Hint(
                        suggestion == null ? List.of() : TableBroadcaster.ids(suggestion)));
            } catch (IllegalActionException e) {
                reject(seat, e);
            }
        });
    }

    /**
     * Handles a client going away. During bidding or playing this ends the deal for everyone:
     * the remaining seats receive {@code player_left} and the table finishes.
     */
    public CompletionStage<Void> disconnect(Seat seat) {
        return onMailbox(null, () -> {
            broadcaster.markDeparted(seat);
            if (state == null || state.isFinished()) {
                return;
            }
            apply(new Action.Abort(seat, "player left"), null);
            log.info("Table {} closed: seat {} disconnected", tableId, seat);
        });
    }

    /**
     * Current state, read through the mailbox so it reflects every action queued before it.
     */
    public CompletionStage<TableState> snapshot() {
        return CompletableFuture.supplyAsync(() -> state, mailbox);
    }

    @Override
    public void close() {
        finished = true;
        mailbox.shutdown();
        try {
            if (!mailbox.awaitTermination(3, TimeUnit.SECONDS)) {
                mailbox.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            mailbox.shutdownNow();
        }
        if (pendingTurn != null) {
            pendingTurn.cancel(false);
        }
    }

    private interface ActionFactory {
        Action create();
    }

    private CompletionStage<Void> submit(Seat seat, ActionFactory factory) {
        return onMailbox(seat, () -> {
            try {
                requireStarted();
                apply(factory.create(), seat);
            } catch (IllegalActionException e) {
                reject(seat, e);
            }
        });
    }

    /**
     * Queues a task on the mailbox. Unexpected failures are logged rather than left in the
     * returned stage, which callers are free to ignore. Once the table is closed the task is
     * dropped and {@code replyTo}, if given, is told so.
     */
    private CompletionStage<Void> onMailbox(Seat replyTo, Runnable task) {
        try {
            return CompletableFuture.runAsync(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Table {}: unexpected failure on the mailbox", tableId, e);
                }
            }, mailbox);
        } catch (RejectedExecutionException e) {
            log.debug("Table {} is closed; dropping request from {}", tableId, replyTo);
            if (replyTo != null) {
                broadcaster.sendTo(replyTo, new ServerMessage.ErrorMessage(RejectReason.WRONG_PHASE.name(),
                        "The table is closed"));
            }
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Runs side effects of an accepted action. A failure here is logged and does not stop the
     * table: the state has already moved on and the next turn must still be armed.
     */
    private void guarded(String what, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Table {}: {} failed", tableId, what, e);
        }
    }

    /**
     * Applies an action on the mailbox thread.
     *
     * @param replyTo seat to notify on rejection, or {@code null} for actions the server made
     * @return {@code true} if the action was accepted
     */
    private boolean apply(Action action, Seat replyTo) {
        Transition transition;
        try {
            transition = engine.apply(state, action);
        } catch (IllegalActionException e) {
            if (replyTo != null) {
                reject(replyTo, e);
            } else {
                log.warn("Table {}: server action {} rejected ({})", tableId, action, e.reason());
            }
            return false;
        }
        TableState before = state;
        state = transition.state();
        turnVersion++;
        steps++;
        cancelPendingTurn();
        guarded("deal log", () -> DealLogger.logStep(tableId, steps, before, action, transition.events()));
        guarded("replication", () -> broadcaster.publish(transition));
        if (before.phase() == Phase.BIDDING && state.phase() == Phase.PLAYING) {
            log.info("Table {}: bidding finalised, landlord {} (bid {})", tableId, state.landlord(),
                    state.bidding().highestBid());
        } else if (state.redeals() > before.redeals()) {
            log.info("Table {}: nobody bid, redeal #{}", tableId, state.redeals());
        }
        if (state.isFinished()) {
            finished = true;
            if (!state.outcome().isAborted()) {
                log.info("Table {}: game over, winner {} landlordWon={} multiplier x{}", tableId,
                        state.outcome().winner(), state.outcome().landlordWon(), state.bombMultiplier());
            }
            long elapsed = System.nanoTime() - startNanos;
            guarded("deal summary", () -> DealLogger.logSummary(tableId, state, steps, elapsed));
            guarded("finish callback", () -> onFinished.accept(this));
        } else {
            scheduleTurn();
        }
        return true;
    }

    private void reject(Seat seat, IllegalActionException e) {
        if (log.isDebugEnabled()) {
            log.debug("Table {}: rejected action from {} ({})", tableId, seat, e.reason());
        }
        broadcaster.sendTo(seat, new ServerMessage.ErrorMessage(e.reason().name(), e.getMessage()));
    }

    private void requireStarted() {
        if (state == null) {
            throw new IllegalActionException(RejectReason.WRONG_PHASE, "The deal has not started");
        }
    }

    private List<Card> resolve(List<String> cardIds) {
        List<Card> cards = new ArrayList<>();
        if (cardIds == null) {
            return cards;
        }
        for (String id : cardIds) {
            Card card = Card.fromId(id);
            if (card == null) {
                throw new IllegalActionException(RejectReason.CARDS_NOT_HELD, "Unknown card: " + id);
            }
            cards.add(card);
        }
        return cards;
    }

    private void scheduleTurn() {
        Seat seat = state.currentSeat();
        long version = turnVersion;
        TableSeat occupant = seats.get(seat.index());
        if (occupant.controller() == SeatController.AI) {
            long jitter = properties.getAiDelayJitterMillis();
            long delay = properties.getAiDelayMillis() + (jitter > 0 ? random.nextInt((int) jitter + 1) : 0);
            pendingTurn = scheduler.schedule(() -> enqueue(() -> aiTurn(version)), delay, TimeUnit.MILLISECONDS);
        } else if (properties.getTurnTimeoutSeconds() > 0) {
            pendingTurn = scheduler.schedule(() -> enqueue(() -> turnTimedOut(version)),
                    properties.getTurnTimeoutSeconds(), TimeUnit.SECONDS);
        }
    }

    private void cancelPendingTurn() {
        if (pendingTurn != null) {
            pendingTurn.cancel(false);
            pendingTurn = null;
        }
    }

    private void enqueue(Runnable task) {
        try {
            mailbox.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Table {} is closed; dropping timer task", tableId);
        }
    }

    private void aiTurn(long version) {
        if (version != turnVersion || state.isFinished()) {
            return;
        }
        Seat seat = state.currentSeat();
        Action action;
        if (state.phase() == Phase.BIDDING) {
            action = new Action.Bid(seat, ai.shouldBid(state.bidding().highestBid()));
        } else {
            List<Card> cards = ai.choosePlay(state.hand(seat), state.lastPlay());
            action = cards == null ? new Action.Pass(seat) : new Action.Play(seat, cards);
        }
        if (!apply(action, null)) {
            apply(automaticAction(seat), null);
        }
    }

    private void turnTimedOut(long version) {
        if (version != turnVersion || state.isFinished()) {
            return;
        }
        Seat seat = state.currentSeat();
        log.info("Table {}: seat {} timed out", tableId, seat);
        apply(automaticAction(seat), null);
    }

    /**
     * Action taken for a seat that did not act in time: decline during bidding, pass when
     * following, and the weakest legal play when leading.
     */
    private Action automaticAction(Seat seat) {
        if (state.phase() == Phase.BIDDING) {
            return new Action.Bid(seat, false);
        }
        if (state.isLeading()) {
            return new Action.Play(seat, ai.choosePlay(state.hand(seat), null));
        }
        return new Action.Pass(seat);
    }

    private String describeSeats() {
        List<String> parts = new ArrayList<>();
        for (TableSeat seat : seats) {
            parts.add(seat.seat() + "=" + seat.nickname() + "(" + seat.controller() + ")");
        }
        return String.join(", ", parts);
    }
}
