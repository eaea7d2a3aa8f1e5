package ai.landlord.game;

import java.util.List;

/**
 * Facts produced by {@link GameEngine} transitions. Events carry absolute seats only; replicating
 * them to clients (and hiding other seats' cards) is the job of the synchronisation layer.
 */
public interface TableEvent {

    /**
     * @param nextBidder seat to bid next, {@code null} once {@code done}
     */
    record BidPlaced(Seat seat, boolean wantsToBid, int highestBid, boolean done, Seat nextBidder)
            implements TableEvent {
    }

    record LandlordAssigned(Seat landlord, List<Card> reserved) implements TableEvent {
        public LandlordAssigned {
            reserved = List.copyOf(reserved);
        }
    }

    /** Nobody bid; fresh hands were dealt and bidding restarts with the same first bidder. */
    record Redealt(Seat firstBidder, int redeals) implements TableEvent {
    }

    /**
     * @param nextSeat seat to act next, {@code null} when the play emptied the hand
     */
    record CardsPlayed(Seat seat, List<Card> cards, HandShape shape, int handSizeRemaining, Seat nextSeat,
            int bombMultiplier) implements TableEvent {
        public CardsPlayed {
            cards = List.copyOf(cards);
        }
    }

    /**
     * @param newTrick {@code true} when this was the second consecutive pass and the next seat
     *                 leads freely
     */
    record Passed(Seat seat, Seat nextSeat, boolean newTrick, int consecutivePasses) implements TableEvent {
    }

    record DealFinished(Seat winner, Seat landlord, boolean landlordWon, List<Card> finalCards,
            HandShape finalShape, int bombMultiplier, List<Integer> scores) implements TableEvent {
        public DealFinished {
            finalCards = List.copyOf(finalCards);
            scores = List.copyOf(scores);
        }
    }

    record DealAborted(Seat seat, String reason) implements TableEvent {
    }
}
