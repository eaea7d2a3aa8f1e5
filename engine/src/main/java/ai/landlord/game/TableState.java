package ai.landlord.game;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of one deal at a three-seat table.
 * <p>
 * States are only produced by {@link GameEngine}; every transition returns a new value and
 * leaves the previous one untouched, so a rejected action can never leave a half-applied
 * state behind.
 * <p>
 * The constructor enforces card conservation: the three hands, the reserved cards (while
 * unclaimed) and the discard pile always add up to the full deck, with no card twice.
 *
 * @param phase             current phase
 * @param hands             hand of each seat in display order, indexed by seat
 * @param reservedCards     the three landlord cards
 * @param landlord          landlord seat, {@code null} during bidding
 * @param currentSeat       seat expected to act
 * @param lastPlay          play to beat, {@code null} when the current seat leads
 * @param consecutivePasses passes since the last play
 * @param bombMultiplier    doubles for every bomb or rocket played in this deal
 * @param bidding           bidding progress (kept after bidding for the winning bid)
 * @param playedCards       discard pile in play order
 * @param outcome           set once the phase is {@link Phase#FINISHED}
 * @param redeals           number of redeals caused by nobody bidding
 */
public record TableState(
        Phase phase,
        List<List<Card>> hands,
        List<Card> reservedCards,
        Seat landlord,
        Seat currentSeat,
        PlayRecord lastPlay,
        int consecutivePasses,
        int bombMultiplier,
        BiddingState bidding,
        List<Card> playedCards,
        DealOutcome outcome,
        int redeals) {

    public TableState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(currentSeat, "currentSeat");
        Objects.requireNonNull(bidding, "bidding");
        if (hands.size() != Seat.COUNT) {
            throw new IllegalArgumentException("Expected " + Seat.COUNT + " hands, got " + hands.size());
        }
        List<List<Card>> sortedHands = new ArrayList<>();
        for (List<Card> hand : hands) {
            sortedHands.add(List.copyOf(Card.sorted(hand)));
        }
        hands = List.copyOf(sortedHands);
        reservedCards = List.copyOf(reservedCards);
        playedCards = List.copyOf(playedCards);
        if (phase != Phase.BIDDING && landlord == null && (outcome == null || !outcome.isAborted())) {
            throw new IllegalStateException("Phase " + phase + " requires a landlord");
        }
        if (phase == Phase.FINISHED && outcome == null) {
            throw new IllegalStateException("Finished deal without an outcome");
        }
        checkConservation(hands, landlord == null ? reservedCards : List.of(), playedCards);
    }

    private static void checkConservation(List<List<Card>> hands, List<Card> unclaimed, List<Card> played) {
        Set<Card> seen = new HashSet<>();
        int total = 0;
        for (List<Card> hand : hands) {
            seen.addAll(hand);
            total += hand.size();
        }
        seen.addAll(unclaimed);
        seen.addAll(played);
        total += unclaimed.size() + played.size();
        if (total != Deck.SIZE || seen.size() != Deck.SIZE) {
            throw new IllegalStateException("Card conservation violated: " + total + " cards, "
                    + seen.size() + " distinct");
        }
    }

    /**
     * Builds the opening state of a deal.
     */
    public static TableState bidding(Deal deal, Seat firstBidder, int redeals) {
        return new TableState(Phase.BIDDING, deal.hands(), deal.reserved(), null, firstBidder, null, 0, 1,
                BiddingState.opening(firstBidder), List.of(), null, redeals);
    }

    public List<Card> hand(Seat seat) {
        return hands.get(seat.index());
    }

    /**
     * Hand sizes indexed by seat.
     */
    public List<Integer> handSizes() {
        List<Integer> sizes = new ArrayList<>();
        for (List<Card> hand : hands) {
            sizes.add(hand.size());
        }
        return List.copyOf(sizes);
    }

    /**
     * {@code true} when the current seat may play any legal combination.
     */
    public boolean isLeading() {
        return lastPlay == null;
    }

    public boolean isFinished() {
        return phase == Phase.FINISHED;
    }

    /**
     * Total cards across hands, unclaimed reserve and discard pile; always the deck size.
     */
    public int totalCards() {
        int total = playedCards.size() + (landlord == null ? reservedCards.size() : 0);
        for (List<Card> hand : hands) {
            total += hand.size();
        }
        return total;
    }

    TableState withBidding(BiddingState next) {
        return new TableState(phase, hands, reservedCards, landlord, next.currentBidder(), lastPlay,
                consecutivePasses, bombMultiplier, next, playedCards, outcome, redeals);
    }

    TableState withLandlord(Seat newLandlord, BiddingState finalBidding) {
        List<List<Card>> newHands = new ArrayList<>(hands);
        List<Card> landlordHand = new ArrayList<>(hand(newLandlord));
        landlordHand.addAll(reservedCards);
        newHands.set(newLandlord.index(), landlordHand);
        return new TableState(Phase.PLAYING, newHands, reservedCards, newLandlord, newLandlord, null, 0,
                bombMultiplier, finalBidding, playedCards, null, redeals);
    }

    TableState withPlay(Seat seat, List<Card> remainingHand, PlayRecord play, int multiplier, Seat next) {
        List<List<Card>> newHands = new ArrayList<>(hands);
        newHands.set(seat.index(), remainingHand);
        List<Card> played = new ArrayList<>(playedCards);
        played.addAll(play.cards());
        return new TableState(phase, newHands, reservedCards, landlord, next, play, 0, multiplier, bidding,
                played, outcome, redeals);
    }

    TableState withPass(Seat next, PlayRecord remainingPlay, int passes) {
        return new TableState(phase, hands, reservedCards, landlord, next, remainingPlay, passes, bombMultiplier,
                bidding, playedCards, outcome, redeals);
    }

    TableState finished(DealOutcome result) {
        return new TableState(Phase.FINISHED, hands, reservedCards, landlord, currentSeat, lastPlay,
                consecutivePasses, bombMultiplier, bidding, playedCards, result, redeals);
    }
}
