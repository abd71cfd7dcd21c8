package com.aiinpocket.combat.model.enums;

/** 掉落池條目的種類：素材或物品類型 */
public enum LootableType {
    MATERIAL,
    ITEM
}
