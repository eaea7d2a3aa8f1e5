package ai.landlord.server;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the table protocol on {@code /ws} when the {@code server} profile is active.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.profiles=server}
 */
@Configuration
@EnableWebSocket
@Profile("server")
public class WebSocketConfig implements WebSocketConfigurer {
    private final TableWebSocketHandler handler;

    public WebSocketConfig(TableWebSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws").setAllowedOriginPatterns("*");
    }
}
