package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.ItemType;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ItemTypeRepository extends JpaRepository<ItemType, String> {
}
