package ai.landlord.game;

/**
 * Thrown by {@link GameEngine#apply(TableState, Action)} when an action violates the rules. The
 * state passed in is left untouched.
 */
public class IllegalActionException extends RuntimeException {
    private final RejectReason reason;

    public IllegalActionException(RejectReason reason) {
        this(reason, reason.getDefaultMessage());
    }

    public IllegalActionException(RejectReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectReason reason() {
        return reason;
    }
}
