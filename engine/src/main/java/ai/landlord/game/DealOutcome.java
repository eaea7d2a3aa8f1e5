package ai.landlord.game;

import java.util.List;

/**
 * How a deal ended: either a seat emptied its hand ({@code winner} set) or the deal was aborted
 * ({@code abortedBy} set, no winner, zero scores).
 */
public record DealOutcome(Seat winner, boolean landlordWon, List<Integer> scores, Seat abortedBy, String abortReason) {
    public DealOutcome {
        scores = List.copyOf(scores);
    }

    public static DealOutcome won(Seat winner, Seat landlord, int bid, int bombMultiplier) {
        boolean landlordWon = winner.equals(landlord);
        return new DealOutcome(winner, landlordWon, Settlement.scores(landlord, landlordWon, bid, bombMultiplier),
                null, null);
    }

    public static DealOutcome aborted(Seat seat, String reason) {
        return new DealOutcome(null, false, List.of(0, 0, 0), seat, reason);
    }

    public boolean isAborted() {
        return abortedBy != null;
    }
}
