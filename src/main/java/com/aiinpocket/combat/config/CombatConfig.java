package com.aiinpocket.combat.config;

import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * 戰鬥核心共用元件。
 * 時鐘、亂數來源與快取計時器皆以 Bean 注入，測試時可替換為固定值。
 */
@Configuration
public class CombatConfig {

    @Bean
    public Clock combatClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomGenerator combatRandom() {
        return new Random();
    }

    @Bean
    public Ticker combatTicker() {
        return Ticker.systemTicker();
    }
}
