package com.aiinpocket.combat.model.enums;

/**
 * 場次的獎勵結算進度。
 * NONE: 尚未開始結算
 * IN_PROGRESS: 結算進行中（此時放棄戰鬥為 no-op）
 * FAILED: 上次結算中途失敗，已套用的步驟保留，可安全重試
 */
public enum SettlementPhase {
    NONE,
    IN_PROGRESS,
    FAILED;

    public boolean hasStarted() {
        return this != NONE;
    }
}
