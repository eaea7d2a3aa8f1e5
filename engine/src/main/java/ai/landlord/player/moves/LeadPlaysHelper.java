package ai.landlord.player.moves;

import ai.landlord.game.Card;
import ai.landlord.game.CardCounts;
import ai.landlord.game.HandShape;
import ai.landlord.game.ShapeType;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates plays when opening a trick: every shape the hand can form.
 * <p>
 * Generation order is singles, pairs, triples, triples with kickers, straights, pair straights,
 * airplanes, four-with-two, bombs and finally the rocket. Callers that rank plays rely on this
 * order to break ties.
 */
public class LeadPlaysHelper extends PlaysHelper {

    @Override
    public List<List<Card>> listLegalPlays(List<Card> hand, HandShape toBeat) {
        if (hand == null || hand.isEmpty()) {
            return new ArrayList<>();
        }
        this.counts = CardCounts.of(hand);
        List<List<Card>> plays = new ArrayList<>();

        addSingles(plays, 0);
        addGroups(plays, 2, 0);
        addGroups(plays, 3, 0);
        addTriplesWithSingle(plays, 0);
        addTriplesWithPair(plays, 0);
        addStraights(plays, 0, 0);
        addPairStraights(plays, 0, 0);
        addAirplanes(plays, ShapeType.AIRPLANE, 0, 0);
        addAirplanes(plays, ShapeType.AIRPLANE_WITH_SINGLES, 0, 0);
        addAirplanes(plays, ShapeType.AIRPLANE_WITH_PAIRS, 0, 0);
        addFoursWithTwo(plays, ShapeType.FOUR_WITH_TWO_SINGLES, 0);
        addFoursWithTwo(plays, ShapeType.FOUR_WITH_TWO_PAIRS, 0);
        addBombs(plays, 0);
        addRocket(plays);

        return finish(plays, null);
    }
}
