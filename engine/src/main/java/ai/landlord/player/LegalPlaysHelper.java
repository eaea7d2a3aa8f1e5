package ai.landlord.player;

import ai.landlord.game.Card;
import ai.landlord.game.HandShape;
import ai.landlord.game.Seat;
import ai.landlord.game.TableState;
import ai.landlord.player.moves.FollowPlaysHelper;
import ai.landlord.player.moves.LeadPlaysHelper;
import java.util.Collections;
import java.util.List;

/**
 * Facade for computing legal plays.
 * <p>
 * Dispatches to the appropriate implementation based on whether a trick is being opened:
 * <ul>
 *   <li><b>Leading:</b> uses {@link LeadPlaysHelper} (every shape the hand can form)
 *   <li><b>Following:</b> uses {@link FollowPlaysHelper} (only plays beating the table)
 * </ul>
 */
public final class LegalPlaysHelper {
    private LegalPlaysHelper() {
    }

    /**
     * Return every legal play for {@code hand}; an empty list means the only option is to pass.
     *
     * @param hand   the cards held
     * @param toBeat shape on the table, or {@code null} when leading
     */
    public static List<List<Card>> listLegalPlays(List<Card> hand, HandShape toBeat) {
        if (hand == null || hand.isEmpty()) {
            return Collections.emptyList();
        }
        if (toBeat == null) {
            return new LeadPlaysHelper().listLegalPlays(hand, null);
        }
        return new FollowPlaysHelper().listLegalPlays(hand, toBeat);
    }

    /**
     * Return every legal play for the given seat in the given state.
     */
    public static List<List<Card>> listLegalPlays(TableState state, Seat seat) {
        HandShape toBeat = state.lastPlay() == null ? null : state.lastPlay().shape();
        return listLegalPlays(state.hand(seat), toBeat);
    }
}
