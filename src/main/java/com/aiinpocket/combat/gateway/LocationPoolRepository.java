package com.aiinpocket.combat.gateway;

import com.aiinpocket.combat.model.domain.EnemyPool;
import com.aiinpocket.combat.model.domain.LootTable;

import java.util.List;

/**
 * 地點的敵人池與戰利品池查詢。
 * 回傳的池已依等級範圍過濾，包含指定地點、同類型地點與通用池。
 */
public interface LocationPoolRepository {

    List<EnemyPool> getEnemyPools(String locationId, int combatLevel);

    List<LootTable> getLootPools(String locationId, int combatLevel);
}
