package ai.landlord.server;

import ai.landlord.sync.ClientChannel;
import ai.landlord.sync.ProtocolCodec;
import ai.landlord.sync.ServerMessage;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * {@link ClientChannel} backed by a WebSocket session. Sends are serialised because several
 * table mailboxes and the lobby may write to the same session.
 */
public class WebSocketSessionChannel implements ClientChannel {
    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionChannel.class);

    private final WebSocketSession session;
    private final ProtocolCodec codec;

    public WebSocketSessionChannel(WebSocketSession session, ProtocolCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(ServerMessage message) {
        String json = codec.encode(message);
        synchronized (session) {
            if (!session.isOpen()) {
                if (log.isDebugEnabled()) {
                    log.debug("Session {} closed; dropping {}", session.getId(), message.getClass().getSimpleName());
                }
                return;
            }
            try {
                session.sendMessage(new TextMessage(json));
            } catch (IOException e) {
                log.warn("Failed to send to session {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
