package ai.landlord.unit.player;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.landlord.game.Card;
import ai.landlord.game.Deck;
import ai.landlord.game.HandClassifier;
import ai.landlord.game.HandShape;
import ai.landlord.game.RandomSource;
import ai.landlord.game.Seat;
import ai.landlord.game.ShapeType;
import ai.landlord.game.TableState;
import ai.landlord.player.LegalPlaysHelper;
import ai.landlord.unit.helpers.Cards;
import ai.landlord.unit.helpers.TestTableStateBuilder;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Legal play enumeration, leading and following.
 *
 * <p>Every returned play must classify, beat the table when following and use only cards from
 * the hand; containment checks use display-sorted card lists.
 */
class LegalPlaysTest {

    private static List<Card> play(String cards) {
        return List.copyOf(Card.sorted(Cards.parse(cards)));
    }

    private static HandShape shape(String cards) {
        return HandClassifier.classify(Cards.parse(cards));
    }

    private static void assertAllLegal(List<Card> hand, HandShape toBeat, List<List<Card>> plays) {
        assertEquals(plays.size(), new HashSet<>(plays).size(), "plays must be distinct");
        for (List<Card> cards : plays) {
            HandShape shape = HandClassifier.classify(cards);
            assertNotNull(shape, "enumerated play does not classify: " + cards);
            assertTrue(hand.containsAll(cards), "play uses cards outside the hand: " + cards);
            if (toBeat != null) {
                assertTrue(shape.beats(toBeat), cards + " does not beat " + toBeat);
            }
        }
    }

    @Test
    void followingPairOfFivesOffersHigherPairsAndTheBomb() {
        List<Card> hand = Cards.parse("5♠ 5♥ 7♠ 7♥ 9♠ 9♥ 8♠ 8♥ 8♦ 8♣");
        HandShape toBeat = shape("5♦ 5♣");

        List<List<Card>> plays = LegalPlaysHelper.listLegalPlays(hand, toBeat);

        assertTrue(plays.contains(play("7♠ 7♥")));
        assertTrue(plays.contains(play("9♠ 9♥")));
        assertTrue(plays.contains(play("8♠ 8♥ 8♦ 8♣")));
        assertFalse(plays.contains(play("5♠ 5♥")));
        assertAllLegal(hand, toBeat, plays);
    }

    @Test
    void leadingAlwaysOffersSomething() {
        for (long seed = 0; seed < 10; seed++) {
            List<Card> hand = Deck.newShuffled(RandomSource.seeded(seed)).deal().hand(Seat.of(0));
            List<List<Card>> plays = LegalPlaysHelper.listLegalPlays(hand, null);
            assertFalse(plays.isEmpty());
            assertAllLegal(hand, null, plays);
        }
    }

    @Test
    void leadingCoversEveryFamilyTheHandCanForm() {
        List<Card> hand = Cards.parse("3♠ 3♥ 3♦ 4♠ 4♥ 4♦ 5♠ 5♥ 6♠ 7♠ 9♣ 9♦ 9♥ 9♠ SJ BJ");

        List<List<Card>> plays = LegalPlaysHelper.listLegalPlays(hand, null);

        assertTrue(plays.contains(play("3♦")));
        assertTrue(plays.contains(play("SJ BJ")));
        assertTrue(plays.contains(play("9♣ 9♦ 9♥ 9♠")));
        assertTrue(plays.stream().anyMatch(p -> HandClassifier.classify(p).type() == ShapeType.STRAIGHT));
        assertTrue(plays.stream().anyMatch(p -> HandClassifier.classify(p).type() == ShapeType.PAIR_STRAIGHT));
        assertTrue(plays.stream().anyMatch(p -> HandClassifier.classify(p).type() == ShapeType.AIRPLANE));
        assertTrue(plays.stream().anyMatch(p -> HandClassifier.classify(p).type() == ShapeType.TRIPLE_WITH_PAIR));
        assertTrue(plays.stream()
                .anyMatch(p -> HandClassifier.classify(p).type() == ShapeType.FOUR_WITH_TWO_SINGLES));
        assertAllLegal(hand, null, plays);
    }

    @Test
    void followingStraightKeepsLength() {
        List<Card> hand = Cards.parse("4♠ 5♥ 6♦ 7♣ 8♠ 9♥ K♠");
        HandShape toBeat = shape("3♠ 4♥ 5♦ 6♣ 7♦");

        List<List<Card>> plays = LegalPlaysHelper.listLegalPlays(hand, toBeat);

        assertEquals(List.of(play("4♠ 5♥ 6♦ 7♣ 8♠"), play("5♥ 6♦ 7♣ 8♠ 9♥")), plays);
    }

    @Test
    void followingTripleWithSingleUsesLowestKicker() {
        List<Card> hand = Cards.parse("J♠ J♥ J♦ 3♣ Q♠");
        HandShape toBeat = shape("9♠ 9♥ 9♦ 4♣");

        List<List<Card>> plays = LegalPlaysHelper.listLegalPlays(hand, toBeat);

        assertEquals(List.of(play("J♠ J♥ J♦ 3♣")), plays);
    }

    @Test
    void airplaneKickersDoNotExtendTheRun() {
        List<Card> hand = Cards.parse("3♠ 3♥ 3♦ 4♠ 4♥ 4♦ 5♠ 5♥ 5♦ 6♠ 6♥ 6♦ 7♠ 7♥ 7♦ K♠ K♥");

        List<List<Card>> plays = LegalPlaysHelper.listLegalPlays(hand, null);

        boolean fourTriplesWithSingles = false;
        for (List<Card> cards : plays) {
            HandShape shape = HandClassifier.classify(cards);
            if (shape.type() == ShapeType.AIRPLANE_WITH_SINGLES && shape.primaryRank() == 6) {
                assertEquals(16, cards.size());
                fourTriplesWithSingles = true;
            }
        }
        assertTrue(fourTriplesWithSingles, "3-6 airplane with singles missing: " + plays);
        assertAllLegal(hand, null, plays);
    }

    @Test
    void onlyHigherBombsAndRocketBeatABomb() {
        List<Card> hand = Cards.parse("8♠ 8♥ 8♦ 8♣ 10♠ 10♥ 10♦ 10♣ SJ BJ");
        HandShape toBeat = shape("9♠ 9♥ 9♦ 9♣");

        List<List<Card>> plays = LegalPlaysHelper.listLegalPlays(hand, toBeat);

        assertEquals(List.of(play("10♠ 10♥ 10♦ 10♣"), play("SJ BJ")), plays);
    }

    @Test
    void nothingBeatsTheRocket() {
        List<Card> hand = Cards.parse("2♠ 2♥ 2♦ 2♣ A♠");
        assertTrue(LegalPlaysHelper.listLegalPlays(hand, shape("SJ BJ")).isEmpty());
    }

    @Test
    void emptyResultMeansPass() {
        List<Card> hand = Cards.parse("3♠ 4♥ 7♦");
        assertTrue(LegalPlaysHelper.listLegalPlays(hand, shape("BJ")).isEmpty());
        assertTrue(LegalPlaysHelper.listLegalPlays(List.of(), null).isEmpty());
    }

    @Test
    void stateOverloadUsesTheSeatsHandAndTheTable() {
        TableState state = TestTableStateBuilder.playing()
                .hand(0, "3♠ K♠")
                .hand(1, "4♠ A♥ 2♣")
                .hand(2, "5♠")
                .lastPlay(0, "K♥")
                .current(1)
                .build();

        List<List<Card>> plays = LegalPlaysHelper.listLegalPlays(state, Seat.of(1));

        assertEquals(List.of(play("A♥"), play("2♣")), plays);
    }
}
