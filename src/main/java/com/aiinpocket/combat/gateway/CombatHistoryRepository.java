package com.aiinpocket.combat.gateway;

import com.aiinpocket.combat.model.domain.CombatHistorySnapshot;
import com.aiinpocket.combat.model.enums.CombatStatus;

/** 玩家在各地點的戰鬥統計 */
public interface CombatHistoryRepository {

    /** 記錄一場戰鬥結果（含連勝計算），回傳更新後的統計 */
    CombatHistorySnapshot upsert(Long userId, String locationId, CombatStatus result);
}
