package com.aiinpocket.combat.service;

import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.gateway.LocationPoolRepository;
import com.aiinpocket.combat.model.domain.EnemyPool;
import com.aiinpocket.combat.model.domain.EnemyPoolMember;
import com.aiinpocket.combat.model.domain.LootEntry;
import com.aiinpocket.combat.model.domain.LootTable;
import com.aiinpocket.combat.model.entity.*;
import com.aiinpocket.combat.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 地點敵人池／戰利品池查詢。
 * 池本身一次查詢，池內成員再以 pool id 批次查詢（固定兩到三次查詢，不會 N+1）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationPoolService implements LocationPoolRepository {

    private final LocationRepository locationRepo;
    private final SpawnPoolRepository spawnPoolRepo;
    private final SpawnPoolMemberRepository spawnMemberRepo;
    private final LootPoolRepository lootPoolRepo;
    private final LootPoolDropRepository lootDropRepo;
    private final LootPoolTierWeightRepository tierWeightRepo;

    @Override
    @Transactional(readOnly = true)
    public List<EnemyPool> getEnemyPools(String locationId, int combatLevel) {
        Location location = requireLocation(locationId);
        List<SpawnPool> pools = spawnPoolRepo.findEligible(locationId, location.getLocationType(), combatLevel);
        if (pools.isEmpty()) {
            return List.of();
        }

        Map<String, List<EnemyPoolMember>> membersByPool = spawnMemberRepo.findByPoolIds(idsOf(pools, SpawnPool::getId))
                .stream()
                .collect(Collectors.groupingBy(m -> m.getPool().getId(), LinkedHashMap::new,
                        Collectors.mapping(m -> new EnemyPoolMember(
                                m.getEnemyTypeId(), m.getWeight(), m.getTier(), m.getStyleId()),
                                Collectors.toList())));

        return pools.stream()
                .map(p -> new EnemyPool(p.getId(), p.getLocationId(), p.getLocationType(),
                        p.getMinLevel(), p.getMaxLevel(), membersByPool.getOrDefault(p.getId(), List.of())))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<LootTable> getLootPools(String locationId, int combatLevel) {
        Location location = requireLocation(locationId);
        List<LootPool> pools = lootPoolRepo.findEligible(locationId, location.getLocationType(), combatLevel);
        if (pools.isEmpty()) {
            return List.of();
        }
        List<String> poolIds = idsOf(pools, LootPool::getId);

        Map<String, List<LootEntry>> dropsByPool = lootDropRepo.findByPoolIds(poolIds).stream()
                .collect(Collectors.groupingBy(d -> d.getPool().getId(), LinkedHashMap::new,
                        Collectors.mapping(d -> new LootEntry(
                                d.getLootableType(), d.getLootableId(), d.getWeight(), d.getTier()),
                                Collectors.toList())));

        Map<String, Map<Integer, Double>> tierWeightsByPool = new HashMap<>();
        for (LootPoolTierWeight w : tierWeightRepo.findByPoolIds(poolIds)) {
            tierWeightsByPool.computeIfAbsent(w.getPool().getId(), k -> new HashMap<>())
                    .put(w.getTier(), w.getMultiplier());
        }

        return pools.stream()
                .map(p -> new LootTable(p.getId(),
                        dropsByPool.getOrDefault(p.getId(), List.of()),
                        tierWeightsByPool.getOrDefault(p.getId(), Map.of())))
                .toList();
    }

    private Location requireLocation(String locationId) {
        return locationRepo.findById(locationId)
                .orElseThrow(() -> new NotFoundException("地點", locationId));
    }

    private static <P> List<String> idsOf(List<P> pools, Function<P, String> idGetter) {
        return pools.stream().map(idGetter).toList();
    }
}
