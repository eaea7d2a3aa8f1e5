package ai.landlord.unit.helpers;

import ai.landlord.game.BiddingState;
import ai.landlord.game.Card;
import ai.landlord.game.HandClassifier;
import ai.landlord.game.HandShape;
import ai.landlord.game.Phase;
import ai.landlord.game.PlayRecord;
import ai.landlord.game.Seat;
import ai.landlord.game.TableState;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fluent builder for mid-deal {@link TableState}s in the playing phase.
 *
 * <p>Tests name only the hands they care about; every card not placed in a hand is treated as
 * already played, so the resulting state always satisfies card conservation.
 *
 * <pre>{@code
 * TableState state = TestTableStateBuilder.playing()
 *     .landlord(0)
 *     .hand(0, "3♠ 4♠ 5♠")
 *     .hand(1, "6♥ 6♦")
 *     .hand(2, "K♣")
 *     .lastPlay(2, "5♥ 5♦")
 *     .current(0)
 *     .build();
 * }</pre>
 */
public final class TestTableStateBuilder {
    private final List<List<Card>> hands = new ArrayList<>();
    private Seat landlord = Seat.of(0);
    private Seat current;
    private PlayRecord lastPlay;
    private int consecutivePasses;
    private int bombMultiplier = 1;
    private int bid = 1;

    private TestTableStateBuilder() {
        for (int i = 0; i < Seat.COUNT; i++) {
            hands.add(new ArrayList<>());
        }
    }

    public static TestTableStateBuilder playing() {
        return new TestTableStateBuilder();
    }

    public TestTableStateBuilder hand(int seat, String cards) {
        hands.set(seat, Cards.parse(cards));
        return this;
    }

    public TestTableStateBuilder landlord(int seat) {
        this.landlord = Seat.of(seat);
        return this;
    }

    public TestTableStateBuilder current(int seat) {
        this.current = Seat.of(seat);
        return this;
    }

    /**
     * Puts a play on the table. The cards must not be in any hand.
     */
    public TestTableStateBuilder lastPlay(int seat, String cards) {
        List<Card> played = Cards.parse(cards);
        HandShape shape = HandClassifier.classify(played);
        if (shape == null) {
            throw new IllegalArgumentException("Not a legal play: " + cards);
        }
        this.lastPlay = new PlayRecord(played, Seat.of(seat), shape);
        return this;
    }

    public TestTableStateBuilder passes(int passes) {
        this.consecutivePasses = passes;
        return this;
    }

    public TestTableStateBuilder multiplier(int multiplier) {
        this.bombMultiplier = multiplier;
        return this;
    }

    public TestTableStateBuilder bid(int bid) {
        this.bid = bid;
        return this;
    }

    public TableState build() {
        Set<Card> held = new HashSet<>();
        for (List<Card> hand : hands) {
            for (Card card : hand) {
                if (!held.add(card)) {
                    throw new IllegalArgumentException("Card dealt twice: " + card);
                }
            }
        }
        List<Card> played = new ArrayList<>();
        for (Card card : Card.all()) {
            if (!held.contains(card)) {
                played.add(card);
            }
        }
        List<Card> reserved = List.of(played.get(0), played.get(1), played.get(2));
        Seat seat = current == null ? landlord : current;
        BiddingState bidding = new BiddingState(Seat.of(0), Seat.of(0), bid, landlord, BiddingState.MAX_BID);
        return new TableState(Phase.PLAYING, hands, reserved, landlord, seat, lastPlay, consecutivePasses,
                bombMultiplier, bidding, played, null, 0);
    }
}
