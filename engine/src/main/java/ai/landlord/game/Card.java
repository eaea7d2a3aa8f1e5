package ai.landlord.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a single card of the 54-card Dou Dizhu deck with a {@link Rank} and a {@link Suit}.
 * <p>
 * Each card is immutable and uniquely identified by its rank and suit combination. The jokers
 * always carry {@link Suit#JOKER}; every other rank carries one of the four standard suits.
 * <p>
 * Cards are ordered by rank value first; the suit only breaks ties so that hands sort in a
 * stable display order. Gameplay comparisons never look at the suit.
 */
public class Card implements Comparable<Card> {
    /** Orders cards by value, then by suit display order. */
    public static final Comparator<Card> DISPLAY_ORDER = Comparator
            .comparingInt(Card::getValue)
            .thenComparingInt(card -> card.getSuit().getDisplayOrder());

    private static final List<Card> ALL;
    private static final Map<String, Card> BY_ID;

    static {
        List<Card> all = new ArrayList<>();
        for (Suit suit : Suit.values()) {
            if (suit == Suit.JOKER) {
                continue;
            }
            for (Rank rank : Rank.values()) {
                if (!rank.isJoker()) {
                    all.add(new Card(rank, suit));
                }
            }
        }
        all.add(new Card(Rank.SMALL_JOKER, Suit.JOKER));
        all.add(new Card(Rank.BIG_JOKER, Suit.JOKER));
        Map<String, Card> byId = new LinkedHashMap<>();
        for (Card card : all) {
            byId.put(card.id(), card);
        }
        ALL = Collections.unmodifiableList(all);
        BY_ID = Collections.unmodifiableMap(byId);
    }

    /** The rank (Three through big joker) of this card. */
    private final Rank rank;
    /** The suit of this card. */
    private final Suit suit;

    /**
     * Constructs a Card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @throws IllegalArgumentException if a joker rank is paired with a standard suit or vice versa
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
        if (rank.isJoker() != (suit == Suit.JOKER)) {
            throw new IllegalArgumentException("Invalid card: " + rank + " of " + suit);
        }
    }

    /**
     * Returns the 54 distinct cards of the deck in a fixed, unshuffled order.
     *
     * @return an unmodifiable list of all cards
     */
    public static List<Card> all() {
        return ALL;
    }

    /**
     * Looks up a card by its wire id (e.g. {@code "♠10"}, {@code "joker_small"}).
     *
     * @param id the card id
     * @return the card, or {@code null} if the id does not name a card
     */
    public static Card fromId(String id) {
        if (id == null) {
            return null;
        }
        return BY_ID.get(id);
    }

    /**
     * Parses a short name such as {@code "10♠"}, {@code "A♥"}, {@code "SJ"} or {@code "BJ"}.
     *
     * @param shortName the short name
     * @return the card
     * @throws IllegalArgumentException if the name does not describe a card
     */
    public static Card parse(String shortName) {
        if (shortName == null || shortName.isBlank()) {
            throw new IllegalArgumentException("Card name must not be blank");
        }
        String name = shortName.trim();
        Rank jokerRank = Rank.fromLabel(name);
        if (jokerRank != null && jokerRank.isJoker()) {
            return new Card(jokerRank, Suit.JOKER);
        }
        Suit suit = Suit.fromSymbol(name.substring(name.length() - 1));
        Rank rank = Rank.fromLabel(name.substring(0, name.length() - 1));
        if (suit == null || rank == null || rank.isJoker()) {
            throw new IllegalArgumentException("Unknown card: " + shortName);
        }
        return new Card(rank, suit);
    }

    /**
     * Returns a sorted copy of the given cards in display order.
     *
     * @param cards the cards to sort
     * @return a new mutable list in display order
     */
    public static List<Card> sorted(Collection<Card> cards) {
        List<Card> copy = new ArrayList<>(cards);
        copy.sort(DISPLAY_ORDER);
        return copy;
    }

    public Rank getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    /**
     * Returns the comparison value of this card's rank.
     *
     * @return the value (3..17)
     */
    public int getValue() {
        return rank.getValue();
    }

    /**
     * Returns the stable wire id of this card.
     * <p>
     * Standard cards use the suit symbol followed by the rank label ({@code "♥A"}); the jokers use
     * {@code "joker_small"} and {@code "joker_big"}.
     *
     * @return the card id
     */
    public String id() {
        if (rank == Rank.SMALL_JOKER) {
            return "joker_small";
        }
        if (rank == Rank.BIG_JOKER) {
            return "joker_big";
        }
        return suit.getSymbol() + rank.getLabel();
    }

    /**
     * Returns a short, non-colored string representation of this card.
     * <p>
     * The format is the rank label followed by the suit symbol (e.g., "Q♠", "10♦");
     * jokers are rendered as "SJ" and "BJ".
     *
     * @return the short name of the card
     */
    public String shortName() {
        if (rank.isJoker()) {
            return rank.getLabel();
        }
        return rank.getLabel() + suit.getSymbol();
    }

    @Override
    public int compareTo(Card other) {
        return DISPLAY_ORDER.compare(this, other);
    }

    /**
     * Returns the short name with ANSI colouring for red suits.
     */
    @Override
    public String toString() {
        return Suit.colouriseIfRed(suit, shortName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
