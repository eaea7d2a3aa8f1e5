package ai.landlord.game;

/**
 * Enumeration of the suits of the 54-card Dou Dizhu deck.
 * <p>
 * The four standard suits are represented by their Unicode symbol; the two jokers share the
 * pseudo-suit {@link #JOKER}. Suits never influence the legality or strength of a play. They only
 * break ties when sorting a hand for display, using {@link #getDisplayOrder()}.
 * <p>
 * This enum also provides ANSI colour formatting utilities for terminal display,
 * allowing red suits to be rendered in red text and black suits in default text.
 */
public enum Suit {
    /** Diamonds – a red suit represented by the ♦ symbol; sorts first within a rank. */
    DIAMONDS("♦", true, 0),
    /** Clubs – a black suit represented by the ♣ symbol. */
    CLUBS("♣", false, 1),
    /** Hearts – a red suit represented by the ♥ symbol. */
    HEARTS("♥", true, 2),
    /** Spades – a black suit represented by the ♠ symbol; sorts last within a rank. */
    SPADES("♠", false, 3),
    /** Pseudo-suit shared by the small and the big joker. */
    JOKER("joker", false, 4);

    /** ANSI escape code for red text output in terminals. */
    private static final String ANSI_RED = "\u001B[31m";
    /** ANSI escape code to reset text formatting in terminals. */
    private static final String ANSI_RESET = "\u001B[0m";

    /** The symbol representing this suit on the wire and in card ids. */
    private final String symbol;
    /** {@code true} if this suit is red (Diamonds or Hearts). */
    private final boolean red;
    /** Tiebreak position used when sorting cards of equal value. */
    private final int displayOrder;

    Suit(String symbol, boolean red, int displayOrder) {
        this.symbol = symbol;
        this.red = red;
        this.displayOrder = displayOrder;
    }

    /**
     * Returns the symbol of this suit.
     *
     * @return the suit symbol (e.g., "♣", "♦", "♥", "♠", or "joker")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Checks whether this suit is red.
     *
     * @return {@code true} if this suit is red; {@code false} otherwise
     */
    public boolean isRed() {
        return red;
    }

    /**
     * Returns the position of this suit in display order (♦ &lt; ♣ &lt; ♥ &lt; ♠ &lt; joker).
     *
     * @return the display order index
     */
    public int getDisplayOrder() {
        return displayOrder;
    }

    /**
     * Resolves a suit from its symbol.
     *
     * @param symbol the suit symbol
     * @return the matching suit, or {@code null} if none matches
     */
    public static Suit fromSymbol(String symbol) {
        for (Suit suit : values()) {
            if (suit.symbol.equals(symbol)) {
                return suit;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }

    /**
     * Colourises the given value string using ANSI red codes if the suit is red.
     *
     * @param suit the suit to check for colour (may be null)
     * @param value the string value to colourise
     * @return the value wrapped in ANSI red codes if suit is red; otherwise the value unchanged
     */
    public static String colouriseIfRed(Suit suit, String value) {
        if (suit != null && suit.isRed()) {
            return ANSI_RED + value + ANSI_RESET;
        }
        return value;
    }
}
