package ai.landlord.player.ai;

import ai.landlord.config.AiProperties;
import ai.landlord.game.Card;
import ai.landlord.game.HandClassifier;
import ai.landlord.game.PlayRecord;
import ai.landlord.game.RandomSource;
import ai.landlord.game.Seat;
import ai.landlord.game.TableState;
import ai.landlord.player.AIPlayer;
import ai.landlord.player.LegalPlaysHelper;
import ai.landlord.player.Player;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Rule-of-thumb opponent:
 *
 * - Bids at random, more eagerly when nobody has bid yet.
 * - Leading: dumps the whole hand if it is small and forms one combination, otherwise plays the
 *   weakest legal play.
 * - Following: plays the weakest non-bomb that beats the table. Bombs are used freely only with
 *   a small hand; otherwise the bomb is held back (pass) part of the time.
 *
 * Notes:
 * - "Weakest" means bombs and the rocket last, then lowest primary rank, then enumeration
 *   order. No card counting or partner reasoning takes place.
 * - All thresholds and probabilities come from {@link AiProperties}.
 */
@Component
@Profile("!ai-human")
public class HeuristicPlayer extends AIPlayer implements Player {
    private static final Logger log = LoggerFactory.getLogger(HeuristicPlayer.class);

    private final AiProperties properties;
    private final RandomSource random;

    public HeuristicPlayer(AiProperties properties, RandomSource random) {
        this.properties = properties;
        this.random = random;
    }

    @Override
    public boolean decideBid(TableState state, Seat seat) {
        return shouldBid(state.bidding().highestBid());
    }

    @Override
    public List<Card> decidePlay(TableState state, Seat seat, String feedback) {
        return choosePlay(state.hand(seat), state.lastPlay());
    }

    /**
     * @param highestBid number of bids placed so far
     * @return {@code true} to bid
     */
    public boolean shouldBid(int highestBid) {
        double p = highestBid == 0 ? properties.getOpenBidProbability() : properties.getRaiseBidProbability();
        return random.nextDouble() < p;
    }

    /**
     * Chooses a play for {@code hand}.
     *
     * @param hand     the cards held
     * @param lastPlay play to beat, or {@code null} when leading
     * @return the cards to play, or {@code null} to pass
     */
    public List<Card> choosePlay(List<Card> hand, PlayRecord lastPlay) {
        List<RankedPlay> ranked = rank(LegalPlaysHelper.listLegalPlays(hand,
                lastPlay == null ? null : lastPlay.shape()));
        if (ranked.isEmpty()) {
            return null;
        }

        if (lastPlay == null) {
            if (hand.size() <= properties.getEmptyHandThreshold() && HandClassifier.classify(hand) != null) {
                return new ArrayList<>(hand);
            }
            return ranked.get(0).cards();
        }

        for (RankedPlay play : ranked) {
            if (!isBomb(play)) {
                return play.cards();
            }
        }
        if (hand.size() <= properties.getFreeBombThreshold()) {
            return ranked.get(0).cards();
        }
        if (random.nextDouble() < properties.getBombHoldProbability()) {
            if (log.isDebugEnabled()) {
                log.debug("Holding bomb back with {} cards in hand", hand.size());
            }
            return null;
        }
        return ranked.get(0).cards();
    }
}
