package com.aiinpocket.combat.model.domain;

/** 敵人池中的一個成員，styleId 為 null 時使用 normal 風格 */
public record EnemyPoolMember(
        String enemyTypeId,
        double weight,
        int tier,
        String styleId
) {}
