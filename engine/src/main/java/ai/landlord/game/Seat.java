package ai.landlord.game;

import java.util.List;

/**
 * Absolute seat at a three-seat table.
 * <p>
 * Seats are only ever compared or advanced through this type; translating an absolute seat into
 * the viewpoint of a particular player happens in exactly one place, {@link #relativeTo(Seat)}.
 */
public record Seat(int index) {
    /** Number of seats at a table. */
    public static final int COUNT = 3;

    private static final List<Seat> ALL = List.of(new Seat(0), new Seat(1), new Seat(2));

    public Seat {
        if (index < 0 || index >= COUNT) {
            throw new IllegalArgumentException("Seat index out of range: " + index);
        }
    }

    public static Seat of(int index) {
        if (index < 0 || index >= COUNT) {
            throw new IllegalArgumentException("Seat index out of range: " + index);
        }
        return ALL.get(index);
    }

    /**
     * All seats in turn order.
     */
    public static List<Seat> all() {
        return ALL;
    }

    /**
     * The seat that acts after this one.
     */
    public Seat next() {
        return of((index + 1) % COUNT);
    }

    /**
     * Translates this absolute seat into the viewpoint of {@code viewer}:
     * {@code (this - viewer + 3) mod 3}.
     *
     * @param viewer the seat owning the view
     * @return {@link RelativeSeat#SELF}, {@link RelativeSeat#LEFT} (acts after the viewer) or
     *         {@link RelativeSeat#RIGHT}
     */
    public RelativeSeat relativeTo(Seat viewer) {
        return RelativeSeat.fromOffset((index - viewer.index + COUNT) % COUNT);
    }

    @Override
    public String toString() {
        return "S" + index;
    }
}
