package ai.landlord.game;

/**
 * Enumeration of the 15 ranks of the Dou Dizhu deck in ascending strength.
 * <p>
 * Each rank carries the numeric value used for every comparison in the game: 3 through 14 for
 * the ranks Three to Ace, 15 for Two, 16 for the small joker and 17 for the big joker. Only the
 * ranks Three to Ace ({@link #isSequenceable()}) may appear in straights, pair straights and
 * airplanes.
 */
public enum Rank {
    /** Three – the weakest rank (value 3). */
    THREE(3, "3"),
    /** Four – rank value 4. */
    FOUR(4, "4"),
    /** Five – rank value 5. */
    FIVE(5, "5"),
    /** Six – rank value 6. */
    SIX(6, "6"),
    /** Seven – rank value 7. */
    SEVEN(7, "7"),
    /** Eight – rank value 8. */
    EIGHT(8, "8"),
    /** Nine – rank value 9. */
    NINE(9, "9"),
    /** Ten – rank value 10. */
    TEN(10, "10"),
    /** Jack – rank value 11. */
    JACK(11, "J"),
    /** Queen – rank value 12. */
    QUEEN(12, "Q"),
    /** King – rank value 13. */
    KING(13, "K"),
    /** Ace – the highest rank allowed in sequences (value 14). */
    ACE(14, "A"),
    /** Two – outranks the Ace but never joins a sequence (value 15). */
    TWO(15, "2"),
    /** Small joker (value 16). */
    SMALL_JOKER(16, "SJ"),
    /** Big joker – the strongest single card (value 17). */
    BIG_JOKER(17, "BJ");

    /** Lowest value allowed in a sequence (Three). */
    public static final int MIN_SEQUENCE_VALUE = 3;
    /** Highest value allowed in a sequence (Ace). */
    public static final int MAX_SEQUENCE_VALUE = 14;

    /** Numeric value of the rank, used for ordering and comparisons (3–17). */
    private final int value;
    /** Short string label for display (e.g., "A", "10", "SJ"). */
    private final String label;

    Rank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    /**
     * Returns the numeric value of this rank.
     *
     * @return the value (3 for Three up to 17 for the big joker)
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the short string label of this rank.
     *
     * @return the label (e.g., "A", "K", "10", "SJ")
     */
    public String getLabel() {
        return label;
    }

    /**
     * Checks whether this rank is one of the two jokers.
     *
     * @return {@code true} for the small or big joker
     */
    public boolean isJoker() {
        return this == SMALL_JOKER || this == BIG_JOKER;
    }

    /**
     * Checks whether this rank may take part in straights, pair straights and airplanes.
     *
     * @return {@code true} for Three through Ace
     */
    public boolean isSequenceable() {
        return isSequenceValue(value);
    }

    /**
     * Checks whether a numeric value lies in the sequence range 3..14.
     *
     * @param value the rank value
     * @return {@code true} if the value may appear in a sequence
     */
    public static boolean isSequenceValue(int value) {
        return value >= MIN_SEQUENCE_VALUE && value <= MAX_SEQUENCE_VALUE;
    }

    /**
     * Resolves a rank from its label (case-insensitive).
     *
     * @param label the rank label
     * @return the matching rank, or {@code null} if none matches
     */
    public static Rank fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (Rank rank : values()) {
            if (rank.label.equalsIgnoreCase(label.trim())) {
                return rank;
            }
        }
        return null;
    }

    /**
     * Resolves a rank from its numeric value.
     *
     * @param value the rank value
     * @return the matching rank, or {@code null} if none matches
     */
    public static Rank fromValue(int value) {
        for (Rank rank : values()) {
            if (rank.value == value) {
                return rank;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
