package ai.landlord.sync;

/**
 * Who supplies the actions of a seat.
 */
public enum SeatController {
    /** A connected client; its turns are guarded by the turn clock. */
    REMOTE,
    /** The heuristic AI, acting after a short thinking delay. */
    AI
}
