package com.aiinpocket.combat.model.domain;

import com.aiinpocket.combat.model.enums.CombatStatus;
import com.aiinpocket.combat.model.enums.SettlementPhase;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 進行中的戰鬥場次（只存在於場次快取中，不落地）。
 *
 * <p>生命週期：開戰時建立並擷取雙方數值快照；只會被攻擊/防禦回合修改；
 * 僅在結算成功、玩家放棄或 TTL 過期時消失。
 * 同一個 sessionId 同時只允許一個動作（由 {@code SessionLockRegistry} 保證）。
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CombatSession {

    private String sessionId;

    private Long userId;

    private String locationId;

    /** 戰鬥等級 1..100，決定敵人池與獎勵 */
    private int combatLevel;

    private EnemySnapshot enemy;

    private PlayerStats player;

    private int playerHp;

    private int enemyHp;

    /** 下一個要執行的回合編號（從 1 開始） */
    @Builder.Default
    private int turnNumber = 1;

    @Builder.Default
    private CombatStatus status = CombatStatus.ONGOING;

    @Builder.Default
    private List<CombatLogEntry> combatLog = new ArrayList<>();

    private Instant createdAt;

    private Instant expiresAt;

    // ===== 結算日誌 =====

    @Builder.Default
    private SettlementPhase settlementPhase = SettlementPhase.NONE;

    /** 第一次結算時建立的獎勵內容，重試時沿用（不重新擲骰） */
    private RewardBundle pendingRewards;

    /** 已完成的發放步驟鍵值，重試時跳過 */
    @Builder.Default
    private Set<String> completedGrants = new LinkedHashSet<>();

    public boolean isOngoing() {
        return status == CombatStatus.ONGOING;
    }

    public boolean isGrantCompleted(String grantKey) {
        return completedGrants.contains(grantKey);
    }

    public void markGrantCompleted(String grantKey) {
        completedGrants.add(grantKey);
    }
}
