package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.config.CombatProperties;
import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.gateway.LocationPoolRepository;
import com.aiinpocket.combat.model.domain.*;
import com.aiinpocket.combat.model.entity.EnemyTier;
import com.aiinpocket.combat.model.entity.EnemyType;
import com.aiinpocket.combat.model.entity.ItemType;
import com.aiinpocket.combat.model.entity.MaterialDefinition;
import com.aiinpocket.combat.model.enums.LootableType;
import com.aiinpocket.combat.repository.EnemyTierRepository;
import com.aiinpocket.combat.repository.EnemyTypeRepository;
import com.aiinpocket.combat.repository.ItemTypeRepository;
import com.aiinpocket.combat.repository.MaterialDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;

/**
 * 敵人與戰利品抽選。
 *
 * <p>敵人：合併地點可用的所有敵人池成員後加權抽一隻，數值依階級成長：
 * {@code 數值 = 基礎值 + 階級偏移 + 每階成長 × (階級 − 1)}。
 *
 * <p>戰利品：合併所有戰利品池項目，權重乘上該池對應階級的倍率後抽 1 ~ maxDrops 件。
 * 素材與物品定義各以一次 {@code findAllById} 批次載入。
 * 掉落物一律繼承敵人的風格；同素材同風格合併成一筆。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CombatContentProvider {

    public static final String NORMAL_STYLE = "normal";

    private final LocationPoolRepository poolRepository;
    private final EnemyTypeRepository enemyTypeRepo;
    private final EnemyTierRepository enemyTierRepo;
    private final MaterialDefinitionRepository materialDefRepo;
    private final ItemTypeRepository itemTypeRepo;
    private final RandomGenerator combatRandom;
    private final CombatProperties props;

    public EnemySnapshot selectEnemy(String locationId, int combatLevel) {
        List<WeightedEntry<EnemyPoolMember>> candidates = new ArrayList<>();
        for (EnemyPool pool : poolRepository.getEnemyPools(locationId, combatLevel)) {
            for (EnemyPoolMember member : pool.members()) {
                candidates.add(WeightedEntry.of(member, member.weight()));
            }
        }

        EnemyPoolMember member = WeightedSelector.selectOne(candidates, combatRandom);
        if (member == null) {
            throw new NotFoundException("地點 " + locationId + " 在等級 " + combatLevel + " 沒有可出現的敵人");
        }

        EnemyType type = enemyTypeRepo.findById(member.enemyTypeId())
                .orElseThrow(() -> new NotFoundException("敵人類型", member.enemyTypeId()));
        EnemyTier tier = enemyTierRepo.findById(member.tier())
                .orElseThrow(() -> new NotFoundException("敵人階級", member.tier()));

        EnemySnapshot enemy = hydrate(type, tier, member);
        log.debug("[戰鬥] 地點 {} Lv.{} 抽出敵人 {}（T{}，風格 {}）",
                locationId, combatLevel, enemy.name(), enemy.tier(), enemy.styleId());
        return enemy;
    }

    public LootDrop selectLoot(String locationId, int combatLevel, EnemySnapshot enemy) {
        List<WeightedEntry<LootEntry>> candidates = new ArrayList<>();
        for (LootTable table : poolRepository.getLootPools(locationId, combatLevel)) {
            for (LootEntry entry : table.entries()) {
                candidates.add(WeightedEntry.of(entry, entry.weight() * table.tierMultiplier(entry.tier())));
            }
        }
        if (candidates.isEmpty()) {
            log.debug("[掉落] 地點 {} Lv.{} 沒有戰利品池", locationId, combatLevel);
            return LootDrop.EMPTY;
        }

        int dropCount = 1 + combatRandom.nextInt(Math.max(1, props.loot().maxDrops()));
        List<LootEntry> picked = WeightedSelector.select(candidates, dropCount, combatRandom);

        Map<String, MaterialDefinition> materials = loadAll(picked, LootableType.MATERIAL,
                materialDefRepo::findAllById, MaterialDefinition::getId, "素材");
        Map<String, ItemType> itemTypes = loadAll(picked, LootableType.ITEM,
                itemTypeRepo::findAllById, ItemType::getId, "物品類型");

        String styleId = enemy.styleId();
        Map<String, MaterialReward> stacks = new LinkedHashMap<>();
        List<ItemReward> items = new ArrayList<>();
        for (LootEntry entry : picked) {
            if (entry.lootableType() == LootableType.MATERIAL) {
                MaterialDefinition def = materials.get(entry.lootableId());
                MaterialReward reward = new MaterialReward(def.getId(), def.getName(), styleId, 1);
                stacks.merge(reward.grantKey(), reward, (a, b) -> a.plus(b.quantity()));
            } else {
                ItemType type = itemTypes.get(entry.lootableId());
                items.add(new ItemReward(type.getId(), type.getName(), type.getRarity(), styleId, null));
            }
        }

        LootDrop drop = new LootDrop(new ArrayList<>(stacks.values()), items);
        log.debug("[掉落] 敵人 {}（風格 {}）掉落 {} 種素材、{} 件物品",
                enemy.name(), styleId, drop.materials().size(), drop.items().size());
        return drop;
    }

    static EnemySnapshot hydrate(EnemyType type, EnemyTier tier, EnemyPoolMember member) {
        int steps = Math.max(0, member.tier() - 1);
        int atk = Math.max(0, type.getBaseAtk() + tier.getAtkOffset() + type.getAtkPerTier() * steps);
        int def = Math.max(0, type.getBaseDef() + tier.getDefOffset() + type.getDefPerTier() * steps);
        int hp = Math.max(1, type.getBaseHp() + tier.getHpOffset() + type.getHpPerTier() * steps);
        String style = member.styleId() == null || member.styleId().isBlank() ? NORMAL_STYLE : member.styleId();

        return new EnemySnapshot(type.getId(), type.getName(), member.tier(), atk, def, hp,
                clampAccuracy(type.getAtkAccuracy()), clampAccuracy(type.getDefAccuracy()),
                style, tier.getGoldMultiplier(), tier.getXpMultiplier());
    }

    private static <T> Map<String, T> loadAll(List<LootEntry> picked, LootableType type,
                                              Function<Set<String>, List<T>> finder,
                                              Function<T, String> idGetter, String resource) {
        Set<String> ids = picked.stream()
                .filter(e -> e.lootableType() == type)
                .map(LootEntry::lootableId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (ids.isEmpty()) {
            return Map.of();
        }
        Map<String, T> loaded = finder.apply(ids).stream()
                .collect(Collectors.toMap(idGetter, Function.identity()));
        for (String id : ids) {
            if (!loaded.containsKey(id)) {
                throw new NotFoundException(resource, id);
            }
        }
        return loaded;
    }

    private static double clampAccuracy(Double accuracy) {
        if (accuracy == null || accuracy.isNaN()) {
            return 0;
        }
        return Math.max(0, Math.min(1, accuracy));
    }
}
