package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.CombatSettlement;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CombatSettlementRepository extends JpaRepository<CombatSettlement, Long> {

    Optional<CombatSettlement> findBySessionId(String sessionId);

    boolean existsBySessionId(String sessionId);
}
