package ai.landlord.player;

import ai.landlord.game.Card;
import ai.landlord.game.HandClassifier;
import ai.landlord.game.HandShape;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Base class for AI players with helpers for ranking candidate plays.
 */
public abstract class AIPlayer implements Player {

    /**
     * Orders plays from weakest to strongest: bombs and the rocket last, then by primary rank.
     * The sort is stable, so equal plays keep their enumeration order.
     */
    protected static final Comparator<RankedPlay> WEAKEST_FIRST = Comparator
            .comparing((RankedPlay play) -> play.shape().type().isBombLike())
            .thenComparingInt(play -> play.shape().primaryRank());

    /**
     * Classifies and sorts plays weakest first.
     */
    protected List<RankedPlay> rank(List<List<Card>> plays) {
        List<RankedPlay> ranked = new ArrayList<>();
        for (List<Card> cards : plays) {
            HandShape shape = HandClassifier.classify(cards);
            if (shape != null) {
                ranked.add(new RankedPlay(cards, shape));
            }
        }
        ranked.sort(WEAKEST_FIRST);
        return ranked;
    }

    protected boolean isBomb(RankedPlay play) {
        return play.shape().type().isBombLike();
    }

    /**
     * A candidate play together with its classification.
     */
    protected record RankedPlay(List<Card> cards, HandShape shape) {
    }
}
