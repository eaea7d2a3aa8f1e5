package ai.landlord.unit.game;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.landlord.game.Seat;
import ai.landlord.game.TableFormatter;
import ai.landlord.game.TableState;
import ai.landlord.unit.helpers.TestTableStateBuilder;
import org.junit.jupiter.api.Test;

/**
 * Console rendering from one seat's point of view.
 */
class TableFormatterTest {

    private static String plain(String text) {
        return text.replaceAll("\\u001B\\[[;\\d]*m", "");
    }

    @Test
    void showsOwnHandAndOnlyCountsForOpponents() {
        TableState state = TestTableStateBuilder.playing()
                .landlord(2)
                .hand(0, "Q♣ K♣")
                .hand(1, "3♠ 4♠ 5♠")
                .hand(2, "A♦")
                .lastPlay(0, "J♦")
                .current(1)
                .build();

        String out = plain(new TableFormatter(state, Seat.of(1)).format());

        assertTrue(out.contains("LEFT *"), out);
        assertTrue(out.contains("> SELF"), out);
        assertTrue(out.contains("3 cards"), out);
        assertTrue(out.contains("YOUR HAND: 3♠ 4♠ 5♠"), out);
        assertTrue(out.contains("ON TABLE: J♦"), out);
        assertFalse(out.contains("Q♣"), out);
        assertFalse(out.contains("A♦"), out);
    }
}
