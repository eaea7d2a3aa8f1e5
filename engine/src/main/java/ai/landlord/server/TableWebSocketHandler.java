package ai.landlord.server;

import ai.landlord.sync.Lobby;
import ai.landlord.sync.ProtocolCodec;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Bridges WebSocket sessions to the {@link Lobby}: one {@link WebSocketSessionChannel} per
 * session, text frames decoded by the lobby, closed sessions reported as disconnects.
 */
@Component
@Profile("server")
public class TableWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(TableWebSocketHandler.class);

    private final Lobby lobby;
    private final ProtocolCodec codec;
    private final Map<String, WebSocketSessionChannel> channels = new ConcurrentHashMap<>();

    public TableWebSocketHandler(Lobby lobby, ProtocolCodec codec) {
        this.lobby = lobby;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        channels.put(session.getId(), new WebSocketSessionChannel(session, codec));
        log.info("Client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSessionChannel channel = channels.computeIfAbsent(session.getId(),
                id -> new WebSocketSessionChannel(session, codec));
        lobby.onMessage(channel, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSessionChannel channel = channels.remove(session.getId());
        if (channel != null) {
            lobby.disconnect(channel);
        }
        log.info("Client disconnected: {} ({})", session.getId(), status);
    }
}
