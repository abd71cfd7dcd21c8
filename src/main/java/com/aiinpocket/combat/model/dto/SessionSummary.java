package com.aiinpocket.combat.model.dto;

import com.aiinpocket.combat.model.domain.CombatLogEntry;
import com.aiinpocket.combat.model.domain.CombatSession;
import com.aiinpocket.combat.model.domain.EnemySnapshot;
import com.aiinpocket.combat.model.domain.WeaponBands;
import com.aiinpocket.combat.model.enums.CombatStatus;
import com.aiinpocket.combat.model.enums.SettlementPhase;

import java.time.Instant;
import java.util.List;

/**
 * 場次檢視（開戰回應與斷線重連時的復原資料）。
 *
 * @param dialBands 依玩家精準度調整後的轉盤區域，前端據此繪製轉盤
 */
public record SessionSummary(
        String sessionId,
        Long userId,
        String locationId,
        int combatLevel,
        EnemySnapshot enemy,
        int playerHp,
        int playerMaxHp,
        int enemyHp,
        int enemyMaxHp,
        int turnNumber,
        CombatStatus status,
        SettlementPhase settlementPhase,
        WeaponBands dialBands,
        List<CombatLogEntry> combatLog,
        Instant createdAt,
        Instant expiresAt
) {

    public static SessionSummary of(CombatSession s, WeaponBands dialBands) {
        return new SessionSummary(
                s.getSessionId(),
                s.getUserId(),
                s.getLocationId(),
                s.getCombatLevel(),
                s.getEnemy(),
                s.getPlayerHp(),
                s.getPlayer().hp(),
                s.getEnemyHp(),
                s.getEnemy().hp(),
                s.getTurnNumber(),
                s.getStatus(),
                s.getSettlementPhase(),
                dialBands,
                List.copyOf(s.getCombatLog()),
                s.getCreatedAt(),
                s.getExpiresAt());
    }
}
