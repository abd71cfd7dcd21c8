package com.aiinpocket.combat.config;

import com.aiinpocket.combat.model.domain.CombatSession;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 快取配置。
 * 戰鬥場次存放在 Caffeine 本地快取，每筆的存活時間由寫入時指定（預設 15 分鐘），
 * 每次寫入都會重新計時，讀取不延長。
 */
@Configuration
public class CacheConfig {

    private static final long MAX_SESSIONS = 100_000;

    @Bean
    public Cache<String, CombatSession> combatSessionCache(Ticker combatTicker, CombatProperties props) {
        return sessionCacheBuilder(combatTicker, props.sessionTtl().toNanos()).build();
    }

    /**
     * 建立場次快取的 builder。
     * 預設存活時間只用於未指定 TTL 的寫入（例如 compute），指定 TTL 的寫入走 {@code expireVariably()}。
     */
    public static Caffeine<String, CombatSession> sessionCacheBuilder(Ticker ticker, long defaultTtlNanos) {
        return Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .maximumSize(MAX_SESSIONS)
                .expireAfter(new Expiry<String, CombatSession>() {
                    @Override
                    public long expireAfterCreate(String key, CombatSession value, long currentTime) {
                        return defaultTtlNanos;
                    }

                    @Override
                    public long expireAfterUpdate(String key, CombatSession value,
                                                  long currentTime, long currentDuration) {
                        return defaultTtlNanos;
                    }

                    @Override
                    public long expireAfterRead(String key, CombatSession value,
                                                long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                });
    }
}
