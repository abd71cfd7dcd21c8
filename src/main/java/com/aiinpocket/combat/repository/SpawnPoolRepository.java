package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.SpawnPool;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SpawnPoolRepository extends JpaRepository<SpawnPool, String> {

    /**
     * 查詢適用於地點與等級的敵人池：指定地點 ∪ 同類型地點 ∪ 通用池。
     */
    @Query("SELECT p FROM SpawnPool p " +
            "WHERE (p.locationId = :locationId " +
            "   OR (p.locationId IS NULL AND p.locationType = :locationType) " +
            "   OR (p.locationId IS NULL AND p.locationType IS NULL)) " +
            "AND p.minLevel <= :level AND p.maxLevel >= :level " +
            "ORDER BY p.id")
    List<SpawnPool> findEligible(@Param("locationId") String locationId,
                                 @Param("locationType") String locationType,
                                 @Param("level") int level);
}
