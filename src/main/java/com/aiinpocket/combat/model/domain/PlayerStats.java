package com.aiinpocket.combat.model.domain;

import com.aiinpocket.combat.exception.ValidationException;

/**
 * 開戰時擷取的玩家裝備數值快照。戰鬥期間不再重新讀取。
 *
 * @param accuracy 命中精準度，範圍 [0, 1]
 * @param weapon   已裝備武器的轉盤區域；未裝備時為預設區域
 */
public record PlayerStats(
        int atk,
        int def,
        int hp,
        double accuracy,
        WeaponBands weapon
) {

    public PlayerStats {
        if (atk < 0 || def < 0) {
            throw new ValidationException("玩家攻擊/防禦不可為負數");
        }
        if (hp <= 0) {
            throw new ValidationException("玩家 HP 必須大於 0");
        }
        if (Double.isNaN(accuracy) || accuracy < 0 || accuracy > 1) {
            throw new ValidationException("玩家精準度必須介於 0 與 1 之間: " + accuracy);
        }
        if (weapon == null) {
            weapon = WeaponBands.DEFAULT;
        }
    }
}
