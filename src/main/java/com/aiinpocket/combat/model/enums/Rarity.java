package com.aiinpocket.combat.model.enums;

/**
 * 物品稀有度等級。
 * 由物品類型定義決定，隨戰利品一併回傳給前端顯示。
 */
public enum Rarity {
    COMMON,
    UNCOMMON,
    RARE,
    EPIC,
    LEGENDARY
}
