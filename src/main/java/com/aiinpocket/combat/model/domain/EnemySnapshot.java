package com.aiinpocket.combat.model.domain;

/**
 * 開戰時選出的敵人（已套用階級加成）。
 *
 * @param styleId         外觀風格，戰利品會繼承此風格
 * @param goldMultiplier  勝利金幣倍率（來自階級）
 * @param xpMultiplier    勝利經驗倍率（來自階級）
 */
public record EnemySnapshot(
        String enemyTypeId,
        String name,
        int tier,
        int atk,
        int def,
        int hp,
        double atkAccuracy,
        double defAccuracy,
        String styleId,
        double goldMultiplier,
        double xpMultiplier
) {}
