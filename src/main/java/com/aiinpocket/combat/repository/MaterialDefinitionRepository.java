package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.MaterialDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MaterialDefinitionRepository extends JpaRepository<MaterialDefinition, String> {
}
