package ai.landlord.server;

import ai.landlord.config.AiProperties;
import ai.landlord.config.TableProperties;
import ai.landlord.game.GameEngine;
import ai.landlord.game.RandomSource;
import ai.landlord.sync.Lobby;
import ai.landlord.sync.ProtocolCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("server")
public class LobbyConfig {

    @Bean(destroyMethod = "close")
    public Lobby lobby(GameEngine engine, AiProperties aiProperties, TableProperties tableProperties,
            @Qualifier("tableScheduler") ScheduledExecutorService tableScheduler, RandomSource randomSource) {
        return new Lobby(engine, aiProperties, tableProperties, tableScheduler, randomSource);
    }

    @Bean
    public ProtocolCodec protocolCodec(ObjectMapper objectMapper) {
        return new ProtocolCodec(objectMapper);
    }
}
