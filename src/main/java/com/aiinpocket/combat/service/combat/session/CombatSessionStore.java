package com.aiinpocket.combat.service.combat.session;

import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.model.domain.CombatSession;

import java.time.Duration;
import java.util.Optional;

/**
 * 戰鬥場次儲存。
 * 每次 {@link #put} 都會重新計算存活時間；過期的場次視同不存在。
 */
public interface CombatSessionStore {

    Optional<CombatSession> find(String sessionId);

    default CombatSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new NotFoundException("戰鬥場次", sessionId));
    }

    void put(CombatSession session, Duration ttl);

    void put(CombatSession session);

    void delete(String sessionId);

    /**
     * 原子性地把場次標記為「結算中」。
     *
     * @return true 表示由本次呼叫取得結算權；false 表示已有其他結算正在進行
     * @throws NotFoundException 場次不存在或已過期
     */
    boolean beginSettlement(String sessionId);

    /** 查詢用戶目前尚未清除的場次（含已分出勝負但尚未結算者） */
    Optional<CombatSession> findActiveByUser(Long userId);
}
