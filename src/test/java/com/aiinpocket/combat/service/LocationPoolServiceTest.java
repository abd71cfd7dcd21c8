package com.aiinpocket.combat.service;

import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.model.domain.EnemyPool;
import com.aiinpocket.combat.model.domain.EnemyPoolMember;
import com.aiinpocket.combat.model.domain.LootTable;
import com.aiinpocket.combat.model.entity.*;
import com.aiinpocket.combat.model.enums.LootableType;
import com.aiinpocket.combat.repository.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LocationPoolServiceTest {

    @Mock
    private LocationRepository locationRepo;
    @Mock
    private SpawnPoolRepository spawnPoolRepo;
    @Mock
    private SpawnPoolMemberRepository spawnMemberRepo;
    @Mock
    private LootPoolRepository lootPoolRepo;
    @Mock
    private LootPoolDropRepository lootDropRepo;
    @Mock
    private LootPoolTierWeightRepository tierWeightRepo;

    @InjectMocks
    private LocationPoolService service;

    private void parkExists() {
        when(locationRepo.findById("loc-park")).thenReturn(Optional.of(
                Location.builder().id("loc-park").name("City Park").locationType("park").build()));
    }

    @Test
    void enemyPoolsAreGroupedWithTheirMembers() {
        parkExists();
        SpawnPool local = SpawnPool.builder().id("sp-park").locationId("loc-park").build();
        SpawnPool universal = SpawnPool.builder().id("sp-any").build();
        when(spawnPoolRepo.findEligible("loc-park", "park", 5)).thenReturn(List.of(local, universal));
        when(spawnMemberRepo.findByPoolIds(List.of("sp-park", "sp-any"))).thenReturn(List.of(
                SpawnPoolMember.builder().id(1L).pool(local).enemyTypeId("goblin").weight(2.0).tier(1).build(),
                SpawnPoolMember.builder().id(2L).pool(universal).enemyTypeId("slime").weight(1.0).tier(3)
                        .styleId("pixel_art").build()));

        List<EnemyPool> pools = service.getEnemyPools("loc-park", 5);

        assertEquals(2, pools.size());
        assertEquals(List.of(new EnemyPoolMember("goblin", 2.0, 1, null)), pools.get(0).members());
        assertEquals(List.of(new EnemyPoolMember("slime", 1.0, 3, "pixel_art")), pools.get(1).members());
        assertNull(pools.get(1).locationId());
    }

    @Test
    void noEligiblePoolSkipsMemberQuery() {
        parkExists();
        when(spawnPoolRepo.findEligible("loc-park", "park", 99)).thenReturn(List.of());

        assertTrue(service.getEnemyPools("loc-park", 99).isEmpty());
        verifyNoInteractions(spawnMemberRepo);
    }

    @Test
    void lootTablesCarryTierWeights() {
        parkExists();
        LootPool pool = LootPool.builder().id("lp-park").locationId("loc-park").build();
        when(lootPoolRepo.findEligible("loc-park", "park", 5)).thenReturn(List.of(pool));
        when(lootDropRepo.findByPoolIds(anyCollection())).thenReturn(List.of(
                LootPoolDrop.builder().id(1L).pool(pool).lootableType(LootableType.MATERIAL)
                        .lootableId("coffee").weight(5.0).tier(2).build()));
        when(tierWeightRepo.findByPoolIds(anyCollection())).thenReturn(List.of(
                LootPoolTierWeight.builder().id(1L).pool(pool).tier(2).multiplier(1.5).build()));

        List<LootTable> tables = service.getLootPools("loc-park", 5);

        assertEquals(1, tables.size());
        assertEquals(1, tables.get(0).entries().size());
        assertEquals(1.5, tables.get(0).tierMultiplier(2));
        assertEquals(1.0, tables.get(0).tierMultiplier(1));
    }

    @Test
    void unknownLocationIsNotFound() {
        when(locationRepo.findById("nowhere")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.getEnemyPools("nowhere", 5));
        assertThrows(NotFoundException.class, () -> service.getLootPools("nowhere", 5));
    }
}
