package com.aiinpocket.combat.model.domain;

import com.aiinpocket.combat.model.enums.LootableType;

/** 戰利品池中的單一掉落項目（素材或物品類型） */
public record LootEntry(
        LootableType lootableType,
        String lootableId,
        double weight,
        int tier
) {}
