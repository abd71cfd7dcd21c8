package com.aiinpocket.combat.model.domain;

import java.util.List;

/** 勝利時擲出的戰利品（尚未發放） */
public record LootDrop(
        List<MaterialReward> materials,
        List<ItemReward> items
) {

    public static final LootDrop EMPTY = new LootDrop(List.of(), List.of());

    public LootDrop {
        materials = materials == null ? List.of() : List.copyOf(materials);
        items = items == null ? List.of() : List.copyOf(items);
    }
}
