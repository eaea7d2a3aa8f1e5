package ai.landlord.game;

import java.util.List;
import java.util.Objects;

/**
 * An action submitted by (or on behalf of) a seat. Every action names the seat it acts for;
 * {@link GameEngine} checks that seat against the turn.
 */
public sealed interface Action permits Action.Bid, Action.Play, Action.Pass, Action.Abort {

    Seat seat();

    /** Bid for the landlord role, or decline. */
    record Bid(Seat seat, boolean wantsToBid) implements Action {
        public Bid {
            Objects.requireNonNull(seat, "seat");
        }
    }

    /** Play the given cards from the seat's hand. */
    record Play(Seat seat, List<Card> cards) implements Action {
        public Play {
            Objects.requireNonNull(seat, "seat");
            cards = cards == null ? List.of() : List.copyOf(cards);
        }
    }

    /** Decline to beat the play on the table. */
    record Pass(Seat seat) implements Action {
        public Pass {
            Objects.requireNonNull(seat, "seat");
        }
    }

    /** Terminates the deal because the seat's player left. */
    record Abort(Seat seat, String reason) implements Action {
        public Abort {
            Objects.requireNonNull(seat, "seat");
        }
    }
}
