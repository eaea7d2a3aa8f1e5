package ai.landlord.game;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rules of a deal as a pure transition function.
 * <p>
 * {@link #apply(TableState, Action)} either returns the next state together with the events
 * the action produced, or throws {@link IllegalActionException}. It never mutates its input and
 * never performs I/O; the only side effect is drawing from the injected {@link RandomSource}
 * when nobody bids and the cards are redealt.
 */
public class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final RandomSource random;

    public GameEngine(RandomSource random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Shuffles and deals a new deal in the bidding phase.
     *
     * @param firstBidder seat that opens the bidding
     * @return the opening state
     */
    public TableState newDeal(Seat firstBidder) {
        return deal(firstBidder, 0);
    }

    private TableState deal(Seat firstBidder, int redeals) {
        Deal deal = Deck.newShuffled(random).deal();
        return TableState.bidding(deal, firstBidder, redeals);
    }

    /**
     * Applies an action to a state.
     *
     * @param state  the current state
     * @param action the action to apply
     * @return the resulting state and events
     * @throws IllegalActionException if the action breaks a rule; {@code state} is unchanged
     */
    public Transition apply(TableState state, Action action) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(action, "action");
        if (state.outcome() != null && state.outcome().isAborted()) {
            throw new IllegalActionException(RejectReason.PEER_DISCONNECTED);
        }
        if (action instanceof Action.Abort abort) {
            return abort(state, abort);
        }
        if (action instanceof Action.Bid bid) {
            return bid(state, bid);
        }
        if (action instanceof Action.Play play) {
            return play(state, play);
        }
        if (action instanceof Action.Pass pass) {
            return pass(state, pass);
        }
        throw new IllegalArgumentException("Unsupported action: " + action);
    }

    private Transition bid(TableState state, Action.Bid bid) {
        requirePhase(state, Phase.BIDDING);
        requireTurn(state, bid.seat());
        BiddingState next = state.bidding().record(bid.wantsToBid());
        if (!next.isComplete(bid.wantsToBid())) {
            return new Transition(state.withBidding(next), List.of(
                    new TableEvent.BidPlaced(bid.seat(), bid.wantsToBid(), next.highestBid(), false,
                            next.currentBidder())));
        }
        TableEvent placed = new TableEvent.BidPlaced(bid.seat(), bid.wantsToBid(), next.highestBid(), true, null);
        Seat landlord = next.highestBidder();
        if (landlord == null) {
            Seat firstBidder = state.bidding().firstBidder();
            int redeals = state.redeals() + 1;
            log.debug("Nobody bid, redealing (redeal #{})", redeals);
            return new Transition(deal(firstBidder, redeals), List.of(
                    placed, new TableEvent.Redealt(firstBidder, redeals)));
        }
        return new Transition(state.withLandlord(landlord, next), List.of(
                placed, new TableEvent.LandlordAssigned(landlord, state.reservedCards())));
    }

    private Transition play(TableState state, Action.Play play) {
        requirePhase(state, Phase.PLAYING);
        Seat seat = play.seat();
        requireTurn(state, seat);
        List<Card> cards = play.cards();
        if (cards.isEmpty()) {
            throw new IllegalActionException(RejectReason.ILLEGAL_SHAPE, "A play needs at least one card");
        }
        List<Card> hand = state.hand(seat);
        Set<Card> chosen = new HashSet<>(cards);
        if (chosen.size() != cards.size() || !hand.containsAll(chosen)) {
            throw new IllegalActionException(RejectReason.CARDS_NOT_HELD);
        }
        HandShape shape = HandClassifier.classify(cards);
        if (shape == null) {
            throw new IllegalActionException(RejectReason.ILLEGAL_SHAPE);
        }
        if (state.lastPlay() != null && !shape.beats(state.lastPlay().shape())) {
            throw new IllegalActionException(RejectReason.CANNOT_BEAT);
        }

        List<Card> remaining = new ArrayList<>(hand);
        remaining.removeAll(chosen);
        int multiplier = shape.type().isBombLike() ? state.bombMultiplier() * 2 : state.bombMultiplier();
        PlayRecord record = new PlayRecord(cards, seat, shape);

        if (remaining.isEmpty()) {
            TableState played = state.withPlay(seat, remaining, record, multiplier, seat);
            DealOutcome outcome = DealOutcome.won(seat, state.landlord(), state.bidding().highestBid(), multiplier);
            return new Transition(played.finished(outcome), List.of(
                    new TableEvent.CardsPlayed(seat, record.cards(), shape, 0, null, multiplier),
                    new TableEvent.DealFinished(seat, state.landlord(), outcome.landlordWon(), record.cards(), shape,
                            multiplier, outcome.scores())));
        }
        Seat next = seat.next();
        return new Transition(state.withPlay(seat, remaining, record, multiplier, next), List.of(
                new TableEvent.CardsPlayed(seat, record.cards(), shape, remaining.size(), next, multiplier)));
    }

    private Transition pass(TableState state, Action.Pass pass) {
        requirePhase(state, Phase.PLAYING);
        requireTurn(state, pass.seat());
        if (state.isLeading()) {
            throw new IllegalActionException(RejectReason.ILLEGAL_PASS);
        }
        int passes = state.consecutivePasses() + 1;
        boolean newTrick = passes >= 2;
        Seat next = pass.seat().next();
        TableState after = newTrick
                ? state.withPass(next, null, 0)
                : state.withPass(next, state.lastPlay(), passes);
        return new Transition(after, List.of(new TableEvent.Passed(pass.seat(), next, newTrick, passes)));
    }

    private Transition abort(TableState state, Action.Abort abort) {
        if (state.isFinished()) {
            throw new IllegalActionException(RejectReason.WRONG_PHASE, "The deal is already over");
        }
        String reason = abort.reason() == null ? "player left" : abort.reason();
        return new Transition(state.finished(DealOutcome.aborted(abort.seat(), reason)), List.of(
                new TableEvent.DealAborted(abort.seat(), reason)));
    }

    private static void requirePhase(TableState state, Phase phase) {
        if (state.phase() != phase) {
            throw new IllegalActionException(RejectReason.WRONG_PHASE);
        }
    }

    private static void requireTurn(TableState state, Seat seat) {
        if (!state.currentSeat().equals(seat)) {
            throw new IllegalActionException(RejectReason.NOT_YOUR_TURN);
        }
    }
}
