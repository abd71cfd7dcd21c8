package com.aiinpocket.combat.gateway;

import com.aiinpocket.combat.model.domain.PlayerStats;

/** 提供玩家目前裝備後的戰鬥數值 */
public interface PlayerStatsProvider {

    /**
     * @throws com.aiinpocket.combat.exception.NotFoundException 玩家不存在
     */
    PlayerStats getEquippedStats(Long userId);
}
