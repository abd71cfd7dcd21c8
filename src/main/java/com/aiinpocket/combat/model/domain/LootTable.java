package com.aiinpocket.combat.model.domain;

import java.util.List;
import java.util.Map;

/**
 * 戰利品池。
 * tierWeights 為該池依敵人階級調整掉落權重的倍率，未設定的階級倍率為 1.0。
 */
public record LootTable(
        String poolId,
        List<LootEntry> entries,
        Map<Integer, Double> tierWeights
) {

    public LootTable {
        entries = entries == null ? List.of() : List.copyOf(entries);
        tierWeights = tierWeights == null ? Map.of() : Map.copyOf(tierWeights);
    }

    public double tierMultiplier(int tier) {
        return tierWeights.getOrDefault(tier, 1.0);
    }
}
