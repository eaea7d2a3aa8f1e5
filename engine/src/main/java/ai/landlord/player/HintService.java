package ai.landlord.player;

import ai.landlord.game.Card;
import ai.landlord.game.PlayRecord;
import ai.landlord.game.RandomSource;
import java.util.List;

/**
 * Suggests a play to a human player who asks for a hint.
 * <p>
 * The suggestion is a uniformly random legal play, so repeated requests cycle through the
 * options rather than always naming the same one.
 */
public class HintService {
    private final RandomSource random;

    public HintService(RandomSource random) {
        this.random = random;
    }

    /**
     * @param hand     the cards held
     * @param lastPlay play to beat, or {@code null} when leading
     * @return a legal play, or {@code null} when passing is the only option
     */
    public List<Card> hint(List<Card> hand, PlayRecord lastPlay) {
        List<List<Card>> plays = LegalPlaysHelper.listLegalPlays(hand, lastPlay == null ? null : lastPlay.shape());
        if (plays.isEmpty()) {
            return null;
        }
        return plays.get(random.nextInt(plays.size()));
    }
}
