package ai.landlord.sync;

import ai.landlord.game.Seat;
import java.util.Objects;

/**
 * Occupant of one seat at a running table.
 *
 * @param channel outbound channel, {@code null} for AI seats
 */
public record TableSeat(Seat seat, SeatController controller, String nickname, ClientChannel channel) {
    public TableSeat {
        Objects.requireNonNull(seat, "seat");
        Objects.requireNonNull(controller, "controller");
        if (controller == SeatController.REMOTE && channel == null) {
            throw new IllegalArgumentException("Remote seat " + seat + " needs a channel");
        }
    }

    public static TableSeat remote(Seat seat, String nickname, ClientChannel channel) {
        return new TableSeat(seat, SeatController.REMOTE, nickname, channel);
    }

    public static TableSeat ai(Seat seat, String nickname) {
        return new TableSeat(seat, SeatController.AI, nickname, null);
    }

    public boolean isRemote() {
        return controller == SeatController.REMOTE;
    }
}
