package ai.landlord.sync;

/**
 * Outbound connection to one client. Implementations must be safe to call from any thread and
 * must not throw on transport failures; a broken connection is reported through the lobby's
 * disconnect path instead.
 */
public interface ClientChannel {

    /**
     * Stable identifier of the connection (e.g. a WebSocket session id).
     */
    String id();

    void send(ServerMessage message);
}
