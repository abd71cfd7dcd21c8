package com.aiinpocket.combat.gateway;

/** 玩家物品實例 */
public interface ItemRepository {

    /**
     * 建立一件物品。
     *
     * @return 新物品 ID
     */
    Long create(Long userId, String itemTypeId, int level, String styleId);
}
