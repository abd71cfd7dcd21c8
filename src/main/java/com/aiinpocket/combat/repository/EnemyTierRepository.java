package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.EnemyTier;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EnemyTierRepository extends JpaRepository<EnemyTier, Integer> {
}
