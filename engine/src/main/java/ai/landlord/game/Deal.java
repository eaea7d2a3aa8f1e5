package ai.landlord.game;

import java.util.List;

/**
 * Result of dealing a deck: three 17-card hands (indexed by seat) and the 3 reserved cards.
 */
public record Deal(List<List<Card>> hands, List<Card> reserved) {
    public Deal {
        hands = List.copyOf(hands);
        reserved = List.copyOf(reserved);
    }

    public List<Card> hand(Seat seat) {
        return hands.get(seat.index());
    }
}
