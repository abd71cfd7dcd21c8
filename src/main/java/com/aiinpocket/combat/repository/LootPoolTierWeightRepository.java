package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.LootPoolTierWeight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface LootPoolTierWeightRepository extends JpaRepository<LootPoolTierWeight, Long> {

    @Query("SELECT w FROM LootPoolTierWeight w JOIN FETCH w.pool WHERE w.pool.id IN :poolIds")
    List<LootPoolTierWeight> findByPoolIds(@Param("poolIds") Collection<String> poolIds);
}
