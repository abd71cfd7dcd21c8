package com.aiinpocket.combat.service.combat.session;

import com.aiinpocket.combat.config.CombatProperties;
import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.model.domain.CombatSession;
import com.aiinpocket.combat.model.enums.SettlementPhase;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Policy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 以 Caffeine 本地快取實作的場次儲存。
 * 每筆場次的 TTL 由 {@link Policy.VarExpiration} 個別設定，另維護 userId → sessionId 索引。
 */
@Component
@Slf4j
public class CaffeineCombatSessionStore implements CombatSessionStore {

    private final Cache<String, CombatSession> cache;
    private final Policy.VarExpiration<String, CombatSession> expiration;
    private final Map<Long, String> activeByUser = new ConcurrentHashMap<>();
    private final Duration defaultTtl;
    private final Clock clock;

    public CaffeineCombatSessionStore(Cache<String, CombatSession> combatSessionCache,
                                      CombatProperties props, Clock combatClock) {
        this.cache = combatSessionCache;
        this.expiration = combatSessionCache.policy().expireVariably()
                .orElseThrow(() -> new IllegalStateException("場次快取必須啟用可變過期時間"));
        this.defaultTtl = props.sessionTtl();
        this.clock = combatClock;
    }

    @Override
    public Optional<CombatSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(sessionId));
    }

    @Override
    public void put(CombatSession session, Duration ttl) {
        session.setExpiresAt(clock.instant().plus(ttl));
        expiration.put(session.getSessionId(), session, ttl);
        activeByUser.put(session.getUserId(), session.getSessionId());
    }

    @Override
    public void put(CombatSession session) {
        put(session, defaultTtl);
    }

    @Override
    public void delete(String sessionId) {
        CombatSession removed = cache.asMap().remove(sessionId);
        if (removed != null) {
            activeByUser.remove(removed.getUserId(), sessionId);
            log.debug("[場次] 已移除場次 {}", sessionId);
        }
    }

    @Override
    public boolean beginSettlement(String sessionId) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        CombatSession session = cache.asMap().computeIfPresent(sessionId, (id, current) -> {
            if (current.getSettlementPhase() != SettlementPhase.IN_PROGRESS) {
                current.setSettlementPhase(SettlementPhase.IN_PROGRESS);
                acquired.set(true);
            }
            return current;
        });
        if (session == null) {
            throw new NotFoundException("戰鬥場次", sessionId);
        }
        return acquired.get();
    }

    @Override
    public Optional<CombatSession> findActiveByUser(Long userId) {
        String sessionId = activeByUser.get(userId);
        if (sessionId == null) {
            return Optional.empty();
        }
        Optional<CombatSession> session = find(sessionId);
        if (session.isEmpty()) {
            // 已過期，清掉索引
            activeByUser.remove(userId, sessionId);
        }
        return session;
    }
}
