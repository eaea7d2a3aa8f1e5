package ai.landlord.player.moves;

import ai.landlord.game.Card;
import ai.landlord.game.CardCounts;
import ai.landlord.game.HandShape;
import ai.landlord.game.ShapeType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates plays that beat the shape on the table.
 * <p>
 * Only shapes of the same type and card count with a strictly higher primary rank qualify,
 * plus bombs (any bomb over a non-bomb, a higher bomb over a bomb) and the rocket. Nothing beats
 * the rocket, so following a rocket always yields an empty list.
 */
public class FollowPlaysHelper extends PlaysHelper {

    @Override
    public List<List<Card>> listLegalPlays(List<Card> hand, HandShape toBeat) {
        Objects.requireNonNull(toBeat, "toBeat");
        if (hand == null || hand.isEmpty() || toBeat.type() == ShapeType.ROCKET) {
            return new ArrayList<>();
        }
        this.counts = CardCounts.of(hand);
        List<List<Card>> plays = new ArrayList<>();
        int above = toBeat.primaryRank();
        int n = toBeat.cardCount();

        switch (toBeat.type()) {
            case SINGLE -> addSingles(plays, above);
            case PAIR -> addGroups(plays, 2, above);
            case TRIPLE -> addGroups(plays, 3, above);
            case TRIPLE_WITH_SINGLE -> addTriplesWithSingle(plays, above);
            case TRIPLE_WITH_PAIR -> addTriplesWithPair(plays, above);
            case STRAIGHT -> addStraights(plays, n, above);
            case PAIR_STRAIGHT -> addPairStraights(plays, n / 2, above);
            case AIRPLANE, AIRPLANE_WITH_SINGLES, AIRPLANE_WITH_PAIRS ->
                    addAirplanes(plays, toBeat.type(), n / toBeat.type().airplaneUnitSize(), above);
            case FOUR_WITH_TWO_SINGLES, FOUR_WITH_TWO_PAIRS -> addFoursWithTwo(plays, toBeat.type(), above);
            case BOMB -> addBombs(plays, above);
            default -> throw new IllegalStateException("Unexpected shape: " + toBeat);
        }
        if (toBeat.type() != ShapeType.BOMB) {
            addBombs(plays, 0);
        }
        addRocket(plays);

        return finish(plays, toBeat);
    }
}
