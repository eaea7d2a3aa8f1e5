package ai.landlord.game;

/**
 * A seat as seen by one player: the player itself, the opponent acting next (left) and the
 * opponent acting last (right).
 */
public enum RelativeSeat {
    SELF(0),
    LEFT(1),
    RIGHT(2);

    private final int offset;

    RelativeSeat(int offset) {
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Maps back to the absolute seat for the given viewer.
     */
    public Seat toAbsolute(Seat viewer) {
        return Seat.of((viewer.index() + offset) % Seat.COUNT);
    }

    static RelativeSeat fromOffset(int offset) {
        for (RelativeSeat seat : values()) {
            if (seat.offset == offset) {
                return seat;
            }
        }
        throw new IllegalArgumentException("Offset out of range: " + offset);
    }
}
