package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.EnemyType;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EnemyTypeRepository extends JpaRepository<EnemyType, String> {
}
