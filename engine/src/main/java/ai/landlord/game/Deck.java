package ai.landlord.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents the 54-card Dou Dizhu deck (13 ranks × 4 suits plus two jokers).
 * <p>
 * A {@code Deck} is shuffled with the injected {@link RandomSource} on construction and can then
 * be {@link #deal() dealt} exactly once into three 17-card hands and the 3 reserved landlord
 * cards.
 */
public class Deck {
    /** Number of cards in a full deck. */
    public static final int SIZE = 54;
    /** Number of cards dealt to each seat. */
    public static final int HAND_SIZE = 17;
    /** Number of cards reserved for the landlord. */
    public static final int RESERVED_SIZE = 3;

    /** The list of cards currently in the deck, in dealing order. */
    private final List<Card> cards = new ArrayList<>();

    /**
     * Constructs a new Deck with all 54 cards shuffled by the given random source.
     *
     * @param random the random source used for the shuffle
     */
    public Deck(RandomSource random) {
        Objects.requireNonNull(random, "random");
        cards.addAll(Card.all());
        random.shuffle(cards);
    }

    /**
     * Convenience factory for a freshly shuffled deck.
     *
     * @param random the random source used for the shuffle
     * @return a new shuffled deck
     */
    public static Deck newShuffled(RandomSource random) {
        return new Deck(random);
    }

    /**
     * Deals the whole deck: cards 0..16, 17..33 and 34..50 go to seats 0, 1 and 2 (each hand
     * sorted in display order) and the final three cards become the reserved landlord cards.
     *
     * @return the dealt hands and reserved cards
     * @throws IllegalStateException if the deck has already been dealt
     */
    public Deal deal() {
        if (cards.size() != SIZE) {
            throw new IllegalStateException("Deck already dealt");
        }
        List<List<Card>> hands = new ArrayList<>();
        for (int seat = 0; seat < 3; seat++) {
            int from = seat * HAND_SIZE;
            hands.add(Collections.unmodifiableList(Card.sorted(cards.subList(from, from + HAND_SIZE))));
        }
        List<Card> reserved = List.copyOf(cards.subList(SIZE - RESERVED_SIZE, SIZE));
        cards.clear();
        return new Deal(hands, reserved);
    }

    /**
     * Returns the number of cards remaining in the deck.
     */
    public int size() {
        return cards.size();
    }

    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }
}
