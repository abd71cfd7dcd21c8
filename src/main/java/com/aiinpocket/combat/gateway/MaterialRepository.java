package com.aiinpocket.combat.gateway;

/** 玩家素材堆疊 */
public interface MaterialRepository {

    /** 累加素材數量；堆疊不存在時建立（upsert） */
    void incrementStack(Long userId, String materialId, String styleId, int quantity);
}
