package com.aiinpocket.combat.model.domain;

import java.util.List;

/**
 * 一個適用於地點與等級範圍的敵人池。
 * locationId 與 locationType 皆為 null 時為通用池。
 */
public record EnemyPool(
        String poolId,
        String locationId,
        String locationType,
        int minLevel,
        int maxLevel,
        List<EnemyPoolMember> members
) {

    public EnemyPool {
        members = members == null ? List.of() : List.copyOf(members);
    }
}
