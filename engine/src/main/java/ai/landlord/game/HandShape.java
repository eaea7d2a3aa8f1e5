package ai.landlord.game;

import java.util.Objects;

/**
 * Classification of a set of cards: its {@link ShapeType}, the rank value that decides
 * comparisons ({@code primaryRank}) and the number of cards.
 * <p>
 * Type and card count together form the comparability key: two shapes of the same type but a
 * different length (for example a 5-card and a 6-card straight) never beat each other.
 */
public record HandShape(ShapeType type, int primaryRank, int cardCount) {

    public HandShape {
        Objects.requireNonNull(type, "type");
        if (cardCount <= 0) {
            throw new IllegalArgumentException("cardCount must be positive");
        }
    }

    /**
     * Checks whether this shape may be played on top of {@code other}.
     * <ul>
     *   <li>The rocket beats everything.</li>
     *   <li>A bomb beats any non-bomb shape, and a lower bomb.</li>
     *   <li>Otherwise the type and card count must match and the primary rank must be strictly
     *       higher.</li>
     * </ul>
     *
     * @param other the shape currently on the table
     * @return {@code true} if this shape outranks {@code other}
     */
    public boolean beats(HandShape other) {
        Objects.requireNonNull(other, "other");
        if (other.type == ShapeType.ROCKET) {
            return false;
        }
        if (type == ShapeType.ROCKET) {
            return true;
        }
        if (type == ShapeType.BOMB) {
            return other.type != ShapeType.BOMB || primaryRank > other.primaryRank;
        }
        if (other.type == ShapeType.BOMB) {
            return false;
        }
        return type == other.type && cardCount == other.cardCount && primaryRank > other.primaryRank;
    }

    @Override
    public String toString() {
        return type.getWireName() + "(" + primaryRank + "x" + cardCount + ")";
    }
}
