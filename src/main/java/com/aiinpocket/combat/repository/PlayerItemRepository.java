package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.PlayerItem;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PlayerItemRepository extends JpaRepository<PlayerItem, Long> {
}
