package com.aiinpocket.combat.model.enums;

/**
 * 戰鬥場次狀態。
 * ONGOING: 戰鬥進行中，可繼續攻擊/防禦
 * VICTORY: 敵方 HP 歸零，討伐成功
 * DEFEAT: 玩家 HP 歸零，戰鬥失敗
 */
public enum CombatStatus {
    ONGOING,
    VICTORY,
    DEFEAT;

    public boolean isTerminal() {
        return this != ONGOING;
    }
}
