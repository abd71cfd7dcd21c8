package com.aiinpocket.combat.model.domain;

import com.aiinpocket.combat.model.enums.Rarity;

/**
 * 結算時建立的一件物品。
 * createdItemId 在物品實際寫入後才會填入。
 */
public record ItemReward(
        String itemTypeId,
        String name,
        Rarity rarity,
        String styleId,
        Long createdItemId
) {

    public ItemReward withCreatedItemId(Long itemId) {
        return new ItemReward(itemTypeId, name, rarity, styleId, itemId);
    }
}
