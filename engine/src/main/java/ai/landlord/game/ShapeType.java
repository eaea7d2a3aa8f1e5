package ai.landlord.game;

/**
 * The recognised hand shapes.
 * <p>
 * The wire name is the lowercase identifier sent in protocol messages; the display name is the
 * label shown next to a play.
 */
public enum ShapeType {
    SINGLE("single", "单张"),
    PAIR("pair", "对子"),
    TRIPLE("triple", "三张"),
    TRIPLE_WITH_SINGLE("triple_one", "三带一"),
    TRIPLE_WITH_PAIR("triple_pair", "三带二"),
    STRAIGHT("straight", "顺子"),
    PAIR_STRAIGHT("straight_pairs", "连对"),
    AIRPLANE("airplane", "飞机"),
    AIRPLANE_WITH_SINGLES("airplane_single", "飞机带单"),
    AIRPLANE_WITH_PAIRS("airplane_pair", "飞机带对"),
    FOUR_WITH_TWO_SINGLES("four_two_single", "四带二"),
    FOUR_WITH_TWO_PAIRS("four_two_pair", "四带两对"),
    BOMB("bomb", "炸弹"),
    ROCKET("rocket", "王炸");

    private final String wireName;
    private final String displayName;

    ShapeType(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    public String getWireName() {
        return wireName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Bombs and the rocket double the multiplier and may beat shapes of any other type.
     */
    public boolean isBombLike() {
        return this == BOMB || this == ROCKET;
    }

    /**
     * Number of cards each core rank contributes for airplane-family shapes (triple plus
     * kicker), used to recover the triple count from a card count.
     */
    public int airplaneUnitSize() {
        return switch (this) {
            case AIRPLANE -> 3;
            case AIRPLANE_WITH_SINGLES -> 4;
            case AIRPLANE_WITH_PAIRS -> 5;
            default -> throw new IllegalStateException("Not an airplane shape: " + this);
        };
    }
}
