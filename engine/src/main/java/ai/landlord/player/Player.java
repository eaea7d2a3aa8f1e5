package ai.landlord.player;

import ai.landlord.game.Card;
import ai.landlord.game.Seat;
import ai.landlord.game.TableState;
import java.util.List;

/**
 * Represents a participant that makes the bidding and playing decisions for one seat.
 */
public interface Player {

    /**
     * Decide whether to bid for the landlord role.
     *
     * @param state current table state; only {@code seat}'s own hand may be inspected
     * @param seat  the seat this player controls
     * @return {@code true} to bid, {@code false} to decline
     */
    boolean decideBid(TableState state, Seat seat);

    /**
     * Decide which cards to play.
     *
     * @param state    current table state; only {@code seat}'s own hand may be inspected
     * @param seat     the seat this player controls
     * @param feedback rejection feedback for the previous attempt this turn, or empty
     * @return the cards to play, or {@code null} to pass
     */
    List<Card> decidePlay(TableState state, Seat seat, String feedback);
}
