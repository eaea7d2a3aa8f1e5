package ai.landlord.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Zero-sum scoring of a finished deal.
 * <p>
 * The base stake is the winning bid times the bomb multiplier. The landlord wins or loses twice
 * the base; each peasant loses or wins the base.
 */
public final class Settlement {
    private Settlement() {
    }

    /**
     * @return per-seat score deltas, indexed by seat
     */
    public static List<Integer> scores(Seat landlord, boolean landlordWon, int bid, int bombMultiplier) {
        int base = Math.max(1, bid) * bombMultiplier;
        int sign = landlordWon ? 1 : -1;
        List<Integer> scores = new ArrayList<>();
        for (Seat seat : Seat.all()) {
            scores.add(seat.equals(landlord) ? 2 * base * sign : -base * sign);
        }
        return List.copyOf(scores);
    }
}
