package ai.landlord.sync;

import static ai.landlord.sync.RecordingChannel.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import ai.landlord.config.AiProperties;
import ai.landlord.config.SchedulerConfig;
import ai.landlord.config.TableProperties;
import ai.landlord.game.Card;
import ai.landlord.game.GameEngine;
import ai.landlord.game.Phase;
import ai.landlord.game.RandomSource;
import ai.landlord.game.Seat;
import ai.landlord.game.TableState;
import ai.landlord.player.HintService;
import ai.landlord.player.ai.HeuristicPlayer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Server-side table: replication, turn enforcement, serialisation, timers and disconnects.
 */
class TableRuntimeTest {
    private static final Seat S0 = Seat.of(0);
    private static final Seat S1 = Seat.of(1);
    private static final Seat S2 = Seat.of(2);

    private ScheduledExecutorService scheduler;
    private TableProperties tableProperties;
    private final List<TableRuntime> runtimes = new ArrayList<>();
    private final AtomicInteger finishedCallbacks = new AtomicInteger();

    private final RecordingChannel a = new RecordingChannel("a");
    private final RecordingChannel b = new RecordingChannel("b");
    private final RecordingChannel c = new RecordingChannel("c");

    @BeforeEach
    void setUp() {
        scheduler = SchedulerConfig.newTableScheduler();
        tableProperties = new TableProperties();
        tableProperties.setAiDelayMillis(0);
        tableProperties.setAiDelayJitterMillis(0);
        tableProperties.setTurnTimeoutSeconds(0);
        tableProperties.setCleanupDelaySeconds(0);
    }

    @AfterEach
    void tearDown() {
        for (TableRuntime runtime : runtimes) {
            runtime.close();
        }
        scheduler.shutdownNow();
    }

    private static AiProperties neverBids() {
        AiProperties properties = new AiProperties();
        properties.setOpenBidProbability(0.0);
        properties.setRaiseBidProbability(0.0);
        return properties;
    }

    private TableRuntime start(List<TableSeat> seats, AiProperties aiProperties) throws Exception {
        RandomSource random = RandomSource.seeded(17);
        TableRuntime runtime = new TableRuntime("t" + runtimes.size(), seats, new GameEngine(random),
                new HeuristicPlayer(aiProperties, random), new HintService(random), tableProperties, scheduler,
                random, r -> finishedCallbacks.incrementAndGet());
        runtimes.add(runtime);
        done(runtime.start());
        return runtime;
    }

    private TableRuntime threeRemote() throws Exception {
        return start(List.of(TableSeat.remote(S0, "ann", a), TableSeat.remote(S1, "bob", b),
                TableSeat.remote(S2, "cy", c)), new AiProperties());
    }

    private TableRuntime practice(AiProperties aiProperties) throws Exception {
        return start(List.of(TableSeat.remote(S0, "ann", a), TableSeat.ai(S1, "Robot 1"),
                TableSeat.ai(S2, "Robot 2")), aiProperties);
    }

    private static <T> T done(CompletionStage<T> stage) throws Exception {
        return stage.toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private static List<String> ids(List<Card> cards) {
        List<String> ids = new ArrayList<>();
        for (Card card : cards) {
            ids.add(card.id());
        }
        return ids;
    }

    @Test
    void everySeatReceivesOnlyItsOwnHand() throws Exception {
        threeRemote();

        Set<String> seen = new HashSet<>();
        List<RecordingChannel> channels = List.of(a, b, c);
        for (int i = 0; i < channels.size(); i++) {
            ServerMessage.GameStart start = channels.get(i).awaitFirst(ServerMessage.GameStart.class);
            assertEquals(i, start.mySeat());
            assertEquals(0, start.firstBidder());
            assertEquals(17, start.myCards().size());
            assertEquals(List.of(17, 17, 17), start.handSizes());
            assertEquals(List.of("ann", "bob", "cy"), start.playerNames());
            for (CardView card : start.myCards()) {
                assertTrue(seen.add(card.id()), "card sent to two seats: " + card.id());
            }
        }
        for (CardView card : a.messages(ServerMessage.GameStart.class).get(0).reservedCards()) {
            assertTrue(seen.add(card.id()));
        }
        assertEquals(54, seen.size());
    }

    @Test
    void outOfTurnActionIsRejectedToTheSenderOnly() throws Exception {
        TableRuntime runtime = threeRemote();

        done(runtime.bid(S1, true));

        ServerMessage.ErrorMessage error = b.awaitFirst(ServerMessage.ErrorMessage.class);
        assertEquals("NOT_YOUR_TURN", error.reason());
        assertEquals(1, a.messages().size());
        assertEquals(1, c.messages().size());
        assertEquals(S0, done(runtime.snapshot()).currentSeat());
    }

    @Test
    void unknownCardIdsAreRejected() throws Exception {
        TableRuntime runtime = threeRemote();

        done(runtime.play(S0, List.of("♠1")));

        assertEquals("CARDS_NOT_HELD", a.awaitFirst(ServerMessage.ErrorMessage.class).reason());
    }

    @Test
    void concurrentSubmissionsAreAppliedOneAtATime() throws Exception {
        TableRuntime runtime = threeRemote();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<CompletableFuture<Void>> submitted = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                submitted.add(CompletableFuture.runAsync(() -> {
                    try {
                        go.await();
                        done(runtime.bid(S0, false));
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                }, pool));
            }
            go.countDown();
            CompletableFuture.allOf(submitted.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        TableState state = done(runtime.snapshot());
        assertEquals(1, state.bidding().bidCount());
        assertEquals(S1, state.currentSeat());
        assertEquals(1, a.messages(ServerMessage.BidUpdate.class).size());
        assertEquals(threads - 1, a.messages(ServerMessage.ErrorMessage.class).size());
        assertEquals(1, b.messages(ServerMessage.BidUpdate.class).size());
    }

    @Test
    void onlyTheLandlordReceivesTheFullHand() throws Exception {
        TableRuntime runtime = threeRemote();

        done(runtime.bid(S0, true));
        done(runtime.bid(S1, false));
        done(runtime.bid(S2, false));

        ServerMessage.BidFinalized landlordView = a.awaitFirst(ServerMessage.BidFinalized.class);
        assertEquals(0, landlordView.landlordSeat());
        assertEquals(20, landlordView.myCards().size());
        assertEquals(List.of(20, 17, 17), landlordView.handSizes());
        assertNull(b.awaitFirst(ServerMessage.BidFinalized.class).myCards());
        assertNull(c.awaitFirst(ServerMessage.BidFinalized.class).myCards());
        assertEquals(3, c.messages(ServerMessage.BidUpdate.class).size());
        assertTrue(c.messages(ServerMessage.BidUpdate.class).get(2).done());
        assertEquals(-1, c.messages(ServerMessage.BidUpdate.class).get(2).nextBidder());
    }

    @Test
    void disconnectAbortsTheTableAndNotifiesPeers() throws Exception {
        TableRuntime runtime = threeRemote();
        int beforeB = b.messages().size();

        done(runtime.disconnect(S1));

        assertEquals(1, a.awaitFirst(ServerMessage.PlayerLeft.class).seat());
        assertEquals(1, c.awaitFirst(ServerMessage.PlayerLeft.class).seat());
        assertEquals(beforeB, b.messages().size());
        assertTrue(runtime.isFinished());
        assertEquals(1, finishedCallbacks.get());
        TableState state = done(runtime.snapshot());
        assertEquals(Phase.FINISHED, state.phase());
        assertTrue(state.outcome().isAborted());

        done(runtime.bid(S0, true));
        assertEquals("PEER_DISCONNECTED", a.awaitFirst(ServerMessage.ErrorMessage.class).reason());
    }

    @Test
    void brokenChannelDoesNotStallTheRobots() throws Exception {
        a.failOn(ServerMessage.BidUpdate.class);
        TableRuntime runtime = practice(neverBids());

        done(runtime.bid(S0, false));

        // Both robots still decline, so the deal is redealt.
        ServerMessage.Redeal redeal = a.awaitFirst(ServerMessage.Redeal.class);
        assertEquals(0, redeal.firstBidder());
        assertTrue(a.messages(ServerMessage.BidUpdate.class).isEmpty());
        TableState state = done(runtime.snapshot());
        assertEquals(Phase.BIDDING, state.phase());
        assertEquals(1, state.redeals());
    }

    @Test
    void brokenChannelDoesNotKeepMessagesFromOtherSeats() throws Exception {
        b.failOn(ServerMessage.BidUpdate.class);
        TableRuntime runtime = threeRemote();

        done(runtime.bid(S0, false));
        done(runtime.bid(S1, false));

        assertEquals(2, c.messages(ServerMessage.BidUpdate.class).size());
        assertEquals(2, a.messages(ServerMessage.BidUpdate.class).size());
        assertTrue(b.messages(ServerMessage.BidUpdate.class).isEmpty());
        assertEquals(S2, done(runtime.snapshot()).currentSeat());
    }

    @Test
    void requestsAfterCloseAreAnsweredWithAnError() throws Exception {
        TableRuntime runtime = threeRemote();
        runtime.close();

        done(runtime.pass(S0));
        done(runtime.hint(S0));
        done(runtime.disconnect(S1));

        List<ServerMessage.ErrorMessage> errors = a.messages(ServerMessage.ErrorMessage.class);
        assertEquals(2, errors.size());
        assertEquals("WRONG_PHASE", errors.get(0).reason());
        assertTrue(b.messages(ServerMessage.ErrorMessage.class).isEmpty());
    }

    @Test
    void idleSeatIsDeclinedWhenItsTurnTimesOut() throws Exception {
        tableProperties.setTurnTimeoutSeconds(1);
        practice(neverBids());

        ServerMessage.BidUpdate first = a.awaitFirst(ServerMessage.BidUpdate.class);
        assertEquals(0, first.seat());
        assertFalse(first.wantsToBid());
        // The robots never bid either, so the cards are redealt.
        ServerMessage.Redeal redeal = a.awaitFirst(ServerMessage.Redeal.class);
        assertEquals(0, redeal.firstBidder());
        assertEquals(17, redeal.myCards().size());
    }

    @Test
    void hintIsSentToTheRequesterWhenItIsTheirTurnToPlay() throws Exception {
        TableRuntime runtime = practice(neverBids());

        done(runtime.hint(S0));
        assertEquals("WRONG_PHASE", a.awaitFirst(ServerMessage.ErrorMessage.class).reason());

        done(runtime.bid(S0, true));
        ServerMessage.BidFinalized finalized = a.awaitFirst(ServerMessage.BidFinalized.class);
        assertEquals(0, finalized.landlordSeat());
        await(() -> {
            try {
                TableState state = done(runtime.snapshot());
                return state.phase() == Phase.PLAYING && state.currentSeat().equals(S0);
            } catch (Exception e) {
                return false;
            }
        });

        done(runtime.hint(S0));
        ServerMessage.Hint hint = a.awaitFirst(ServerMessage.Hint.class);
        assertFalse(hint.cardIds().isEmpty());
        Set<String> hand = new HashSet<>();
        for (CardView card : finalized.myCards()) {
            hand.add(card.id());
        }
        assertTrue(hand.containsAll(hint.cardIds()));
    }

    @Test
    void practiceDealPlaysThroughToGameOver() throws Exception {
        TableRuntime runtime = practice(new AiProperties());
        HeuristicPlayer driver = new HeuristicPlayer(new AiProperties(), RandomSource.seeded(99));
        long deadline = System.currentTimeMillis() + 30_000;

        while (!runtime.isFinished()) {
            if (System.currentTimeMillis() > deadline) {
                fail("deal did not finish");
            }
            TableState state = done(runtime.snapshot());
            if (state.isFinished()) {
                break;
            }
            if (!state.currentSeat().equals(S0)) {
                Thread.sleep(5);
                continue;
            }
            if (state.phase() == Phase.BIDDING) {
                done(runtime.bid(S0, driver.shouldBid(state.bidding().highestBid())));
            } else {
                List<Card> cards = driver.choosePlay(state.hand(S0), state.lastPlay());
                done(cards == null ? runtime.pass(S0) : runtime.play(S0, ids(cards)));
            }
        }

        ServerMessage.GameOver over = a.awaitFirst(ServerMessage.GameOver.class);
        assertEquals(over.winnerSeat() == over.landlordSeat(), over.landlordWon());
        assertEquals(0, over.scores().stream().mapToInt(Integer::intValue).sum());
        assertTrue(a.messages(ServerMessage.ErrorMessage.class).isEmpty());
        List<ServerMessage.PlayUpdate> plays = a.messages(ServerMessage.PlayUpdate.class);
        ServerMessage.PlayUpdate last = plays.get(plays.size() - 1);
        assertEquals(over.winnerSeat(), last.seat());
        assertEquals(0, last.handSizeRemaining());
        assertNotNull(over.finalShapeType());
        await(() -> finishedCallbacks.get() == 1);
    }
}
