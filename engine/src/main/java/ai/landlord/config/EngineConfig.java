package ai.landlord.config;

import ai.landlord.game.GameEngine;
import ai.landlord.game.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the rules engine and its source of randomness.
 */
@Configuration
public class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public RandomSource randomSource(TableProperties tableProperties) {
        Long seed = tableProperties.getSeed();
        if (seed != null) {
            log.info("Using seeded random source (seed={})", seed);
            return RandomSource.seeded(seed);
        }
        return RandomSource.threadLocal();
    }

    @Bean
    public GameEngine gameEngine(RandomSource randomSource) {
        return new GameEngine(randomSource);
    }
}
