package com.stockgame.config;

import java.time.Clock;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Infrastructure beans for the engine: the clock used for turn-log timestamps and the random
 * source behind card dealing. Setting {@code stockgame.cards.seed} makes dealing reproducible.
 */
@Configuration
public class GameEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(GameEngineConfig.class);

    @Bean
    public Clock gameClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random cardRandom(@Value("${stockgame.cards.seed:#{null}}") Long seed) {
        if (seed != null) {
            log.info("Card dealing seeded with {}", seed);
            return new Random(seed);
        }
        return new Random();
    }
}
