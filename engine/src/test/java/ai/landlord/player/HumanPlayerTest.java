package ai.landlord.player;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ai.landlord.game.Card;
import ai.landlord.unit.helpers.Cards;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Console input parsing for the human player.
 */
class HumanPlayerTest {
    private final List<Card> hand = Cards.parse("3♦ 3♠ 10♥ J♣ SJ");

    @Test
    void rankLabelsPickAnyCardOfThatRank() {
        assertEquals(Cards.parse("3♦ 3♠"), HumanPlayer.parseSelection("3 3", hand));
        assertEquals(Cards.parse("J♣ SJ"), HumanPlayer.parseSelection("j sj", hand));
    }

    @Test
    void exactShortNamesPickThatCard() {
        assertEquals(Cards.parse("3♠ 10♥"), HumanPlayer.parseSelection("3♠ 10♥", hand));
    }

    @Test
    void unknownOrUnavailableCardsAreRejected() {
        assertNull(HumanPlayer.parseSelection("3 3 3", hand));
        assertNull(HumanPlayer.parseSelection("K", hand));
        assertNull(HumanPlayer.parseSelection("10♠", hand));
        assertNull(HumanPlayer.parseSelection("xyz", hand));
        assertNull(HumanPlayer.parseSelection("  ", hand));
    }
}
