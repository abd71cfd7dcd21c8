package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.PlayerCombatHistory;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PlayerCombatHistoryRepository extends JpaRepository<PlayerCombatHistory, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM PlayerCombatHistory h WHERE h.userId = :userId AND h.locationId = :locationId")
    Optional<PlayerCombatHistory> findForUpdate(@Param("userId") Long userId,
                                                @Param("locationId") String locationId);
}
