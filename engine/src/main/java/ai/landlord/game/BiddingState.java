package ai.landlord.game;

import java.util.Objects;

/**
 * Progress of the bidding round.
 *
 * @param firstBidder   seat that opened the bidding
 * @param currentBidder seat expected to act next
 * @param highestBid    number of bids so far, capped at {@link #MAX_BID}
 * @param highestBidder seat holding the highest bid, or {@code null} if nobody bid yet
 * @param bidCount      bid or decline actions taken so far
 */
public record BiddingState(Seat firstBidder, Seat currentBidder, int highestBid, Seat highestBidder, int bidCount) {
    /** A bid at this level, or this many actions, ends the bidding. */
    public static final int MAX_BID = 3;

    public BiddingState {
        Objects.requireNonNull(firstBidder, "firstBidder");
        Objects.requireNonNull(currentBidder, "currentBidder");
        if (highestBid < 0 || highestBid > MAX_BID) {
            throw new IllegalArgumentException("highestBid out of range: " + highestBid);
        }
    }

    public static BiddingState opening(Seat firstBidder) {
        return new BiddingState(firstBidder, firstBidder, 0, null, 0);
    }

    /**
     * Records one bid or decline by the current bidder.
     */
    public BiddingState record(boolean wantsToBid) {
        int highest = wantsToBid ? Math.min(highestBid + 1, MAX_BID) : highestBid;
        Seat bidder = wantsToBid ? currentBidder : highestBidder;
        return new BiddingState(firstBidder, currentBidder.next(), highest, bidder, bidCount + 1);
    }

    /**
     * Bidding ends when a bid reaches {@link #MAX_BID} or every seat has acted once.
     */
    public boolean isComplete(boolean lastWasBid) {
        return (lastWasBid && highestBid >= MAX_BID) || bidCount >= MAX_BID;
    }
}
