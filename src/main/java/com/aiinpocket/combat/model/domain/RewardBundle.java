package com.aiinpocket.combat.model.domain;

import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.model.dto.LevelUpResult;
import com.aiinpocket.combat.model.enums.CombatStatus;

import java.util.List;

/**
 * 一場戰鬥的完整獎勵內容。
 *
 * <p>建構時即檢查一致性：outcome 只能是 VICTORY 或 DEFEAT，
 * 戰敗獎勵不得包含金幣、素材、物品或經驗值。
 * 結算完成後以 JSON 形式存入結算標記，重複領取時直接回傳。
 *
 * @param history 結算時寫入的戰鬥統計；尚未寫入前為 null
 * @param levelUp 經驗值發放後的升級結果；戰敗或尚未發放時為 null
 */
public record RewardBundle(
        CombatStatus outcome,
        long gold,
        List<MaterialReward> materials,
        List<ItemReward> items,
        long experience,
        CombatHistorySnapshot history,
        LevelUpResult levelUp
) {

    public RewardBundle {
        if (outcome == null || !outcome.isTerminal()) {
            throw new ValidationException("獎勵結果必須為 VICTORY 或 DEFEAT: " + outcome);
        }
        if (gold < 0 || experience < 0) {
            throw new ValidationException("獎勵金幣與經驗值不可為負數");
        }
        materials = materials == null ? List.of() : List.copyOf(materials);
        items = items == null ? List.of() : List.copyOf(items);
        for (MaterialReward m : materials) {
            if (m.quantity() <= 0) {
                throw new ValidationException("素材數量必須大於 0: " + m.materialId());
            }
        }
        if (outcome == CombatStatus.DEFEAT
                && (gold != 0 || experience != 0 || !materials.isEmpty() || !items.isEmpty())) {
            throw new ValidationException("戰敗獎勵不可包含金幣、素材、物品或經驗值");
        }
    }

    public static RewardBundle victory(long gold, long experience, LootDrop loot) {
        return new RewardBundle(CombatStatus.VICTORY, gold, loot.materials(), loot.items(),
                experience, null, null);
    }

    public static RewardBundle defeat() {
        return new RewardBundle(CombatStatus.DEFEAT, 0, List.of(), List.of(), 0, null, null);
    }

    public RewardBundle withItems(List<ItemReward> newItems) {
        return new RewardBundle(outcome, gold, materials, newItems, experience, history, levelUp);
    }

    public RewardBundle withHistory(CombatHistorySnapshot newHistory) {
        return new RewardBundle(outcome, gold, materials, items, experience, newHistory, levelUp);
    }

    public RewardBundle withLevelUp(LevelUpResult newLevelUp) {
        return new RewardBundle(outcome, gold, materials, items, experience, history, newLevelUp);
    }
}
