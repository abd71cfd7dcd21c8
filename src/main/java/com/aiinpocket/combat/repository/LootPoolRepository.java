package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.LootPool;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface LootPoolRepository extends JpaRepository<LootPool, String> {

    @Query("SELECT p FROM LootPool p " +
            "WHERE (p.locationId = :locationId " +
            "   OR (p.locationId IS NULL AND p.locationType = :locationType) " +
            "   OR (p.locationId IS NULL AND p.locationType IS NULL)) " +
            "AND p.minLevel <= :level AND p.maxLevel >= :level " +
            "ORDER BY p.id")
    List<LootPool> findEligible(@Param("locationId") String locationId,
                                @Param("locationType") String locationType,
                                @Param("level") int level);
}
