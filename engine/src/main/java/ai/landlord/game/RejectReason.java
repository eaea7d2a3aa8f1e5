package ai.landlord.game;

/**
 * Why an action was rejected. The name is sent to clients verbatim in {@code error} messages.
 */
public enum RejectReason {
    /** The action does not belong to the current phase. */
    WRONG_PHASE("That action is not allowed right now"),
    /** Another seat is expected to act. */
    NOT_YOUR_TURN("It is not your turn"),
    /** Unknown, duplicated or unheld cards. */
    CARDS_NOT_HELD("You do not hold those cards"),
    /** The cards do not form a recognised combination. */
    ILLEGAL_SHAPE("Those cards do not form a valid combination"),
    /** The combination does not beat the play on the table. */
    CANNOT_BEAT("That does not beat the last play"),
    /** Passing while leading a new trick. */
    ILLEGAL_PASS("You must play when leading a new trick"),
    /** The table was closed because a player left. */
    PEER_DISCONNECTED("The table was closed because a player left"),
    /** The message could not be decoded. */
    MALFORMED_MESSAGE("Malformed message"),
    /** The sender is not seated at a table, or is already queued or seated. */
    NOT_SEATED("You are not at a table");

    private final String defaultMessage;

    RejectReason(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
