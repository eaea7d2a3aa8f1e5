package ai.landlord;

import ai.landlord.config.AiProperties;
import ai.landlord.game.Action;
import ai.landlord.game.Card;
import ai.landlord.game.GameEngine;
import ai.landlord.game.IllegalActionException;
import ai.landlord.game.Phase;
import ai.landlord.game.RandomSource;
import ai.landlord.game.Seat;
import ai.landlord.game.TableEvent;
import ai.landlord.game.TableFormatter;
import ai.landlord.game.TableState;
import ai.landlord.game.Transition;
import ai.landlord.player.AIPlayer;
import ai.landlord.player.Player;
import ai.landlord.player.ai.HeuristicPlayer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);
    /** Rejected attempts tolerated in one turn before the seat's move is chosen automatically. */
    private static final int MAX_REJECTIONS_PER_TURN = 5;

    private final Player player;
    private final GameEngine engine;
    private final AiProperties aiProperties;
    private final RandomSource random;
    private final Environment environment;

    public Game(Player player, GameEngine engine, AiProperties aiProperties, RandomSource random,
            Environment environment) {
        this.player = player;
        this.engine = engine;
        this.aiProperties = aiProperties;
        this.random = random;
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(Game.class, args);
    }

    @Override
    public void run(String... args) {
        // The server profile hosts tables over WebSocket instead of playing locally.
        if (environment != null && environment.acceptsProfiles(Profiles.of("server"))) {
            return;
        }
        GameResult result = play();
        log.info("Deal finished: winner={} landlord={} landlordWon={} scores={}",
                result.winner(), result.landlord(), result.landlordWon(), result.scores());
    }

    /**
     * Plays one offline deal: the configured player in seat 0 against two heuristic opponents.
     * Used by both the CLI runner and automated tests.
     *
     * @return the outcome of the deal and how long it took
     */
    public GameResult play() {
        HeuristicPlayer fallback = new HeuristicPlayer(aiProperties, random);
        List<Player> players = List.of(player, new HeuristicPlayer(aiProperties, random),
                new HeuristicPlayer(aiProperties, random));
        boolean aiMode = player instanceof AIPlayer;
        String tableId = "offline-" + Long.toHexString(System.nanoTime());
        final int maxActions = Integer.getInteger("max.actions.per.deal", 2_000);

        long startNanos = System.nanoTime();
        TableState state = engine.newDeal(Seat.of(0));
        String feedback = "";
        int rejections = 0;
        int steps = 0;

        while (state.phase() != Phase.FINISHED && steps < maxActions) {
            Seat seat = state.currentSeat();
            Player current = players.get(seat.index());
            if (rejections >= MAX_REJECTIONS_PER_TURN) {
                current = fallback;
            }
            Action action = decide(current, state, seat, feedback);
            try {
                Transition transition = engine.apply(state, action);
                DealLogger.logStep(tableId, steps, state, action, transition.events());
                for (TableEvent event : transition.events()) {
                    if (log.isDebugEnabled()) {
                        log.debug("{}", event);
                    }
                }
                state = transition.state();
                feedback = "";
                rejections = 0;
                steps++;
            } catch (IllegalActionException e) {
                rejections++;
                feedback = "Rejected (" + e.reason() + "): " + e.getMessage();
                if (log.isDebugEnabled()) {
                    log.debug("Rejected action from {}: {} ({})", seat, action, e.reason());
                }
            }
        }
        if (!aiMode && state.isFinished()) {
            System.out.println(new TableFormatter(state, Seat.of(0)).format());
        }

        long durationNanos = System.nanoTime() - startNanos;
        DealLogger.logSummary(tableId, state, steps, durationNanos);
        if (state.outcome() == null) {
            log.warn("Deal stopped after {} actions without a winner", steps);
            return new GameResult(null, state.landlord(), false, List.of(0, 0, 0), steps, state.redeals(),
                    durationNanos);
        }
        return new GameResult(state.outcome().winner(), state.landlord(), state.outcome().landlordWon(),
                state.outcome().scores(), steps, state.redeals(), durationNanos);
    }

    private static Action decide(Player player, TableState state, Seat seat, String feedback) {
        if (state.phase() == Phase.BIDDING) {
            return new Action.Bid(seat, player.decideBid(state, seat));
        }
        List<Card> cards = player.decidePlay(state, seat, feedback);
        return cards == null ? new Action.Pass(seat) : new Action.Play(seat, cards);
    }

    /**
     * Summary of an offline deal.
     *
     * @param winner        seat that emptied its hand, {@code null} if the deal did not finish
     * @param landlord      landlord seat
     * @param landlordWon   whether the landlord won
     * @param scores        per-seat settlement
     * @param actions       accepted actions, bids included
     * @param redeals       redeals caused by nobody bidding
     * @param durationNanos wall-clock duration
     */
    public record GameResult(Seat winner, Seat landlord, boolean landlordWon, List<Integer> scores, int actions,
            int redeals, long durationNanos) {
    }
}
