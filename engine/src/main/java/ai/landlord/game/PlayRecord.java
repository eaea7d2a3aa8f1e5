package ai.landlord.game;

import java.util.List;
import java.util.Objects;

/**
 * A play that is currently on the table: the cards, who played them and their shape.
 */
public record PlayRecord(List<Card> cards, Seat seat, HandShape shape) {
    public PlayRecord {
        cards = List.copyOf(Card.sorted(cards));
        Objects.requireNonNull(seat, "seat");
        Objects.requireNonNull(shape, "shape");
    }
}
