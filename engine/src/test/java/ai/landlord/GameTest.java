package ai.landlord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.landlord.config.AiProperties;
import ai.landlord.game.Action;
import ai.landlord.game.Card;
import ai.landlord.game.GameEngine;
import ai.landlord.game.Phase;
import ai.landlord.game.RandomSource;
import ai.landlord.game.Seat;
import ai.landlord.game.TableEvent;
import ai.landlord.game.TableState;
import ai.landlord.game.Transition;
import ai.landlord.player.ai.HeuristicPlayer;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Full AI-vs-AI-vs-AI deals, both through the offline runner and step by step through the
 * engine.
 */
class GameTest {
    private static final int MAX_STEPS = 2_000;

    @Test
    void offlineDealsFinishWithConsistentSettlement() {
        for (long seed = 1; seed <= 10; seed++) {
            RandomSource random = RandomSource.seeded(seed);
            AiProperties properties = new AiProperties();
            Game game = new Game(new HeuristicPlayer(properties, random), new GameEngine(random), properties,
                    random, null);

            Game.GameResult result = game.play();

            assertNotNull(result.winner(), "seed " + seed + " did not finish");
            assertNotNull(result.landlord());
            assertEquals(result.winner().equals(result.landlord()), result.landlordWon());
            assertEquals(0, result.scores().stream().mapToInt(Integer::intValue).sum());
            int landlordScore = result.scores().get(result.landlord().index());
            assertEquals(result.landlordWon(), landlordScore > 0);
        }
    }

    @Test
    void exactlyOneSeatEmptiesItsHandAndCardsAreConserved() {
        RandomSource random = RandomSource.seeded(2024);
        GameEngine engine = new GameEngine(random);
        HeuristicPlayer ai = new HeuristicPlayer(new AiProperties(), random);

        TableState state = engine.newDeal(Seat.of(0));
        TableEvent.DealFinished finished = null;
        int steps = 0;
        while (state.phase() != Phase.FINISHED && steps++ < MAX_STEPS) {
            Seat seat = state.currentSeat();
            Action action;
            if (state.phase() == Phase.BIDDING) {
                action = new Action.Bid(seat, ai.decideBid(state, seat));
            } else {
                List<Card> cards = ai.decidePlay(state, seat, "");
                action = cards == null ? new Action.Pass(seat) : new Action.Play(seat, cards);
            }
            Transition t = engine.apply(state, action);
            state = t.state();
            assertEquals(54, state.totalCards());
            for (TableEvent event : t.events()) {
                if (event instanceof TableEvent.DealFinished done) {
                    finished = done;
                }
            }
        }

        assertEquals(Phase.FINISHED, state.phase());
        assertNotNull(finished);
        long emptyHands = state.handSizes().stream().filter(size -> size == 0).count();
        assertEquals(1, emptyHands);
        assertTrue(state.hand(finished.winner()).isEmpty());
        assertEquals(finished.winner().equals(finished.landlord()), finished.landlordWon());
        assertEquals(state.landlord(), finished.landlord());
    }
}
