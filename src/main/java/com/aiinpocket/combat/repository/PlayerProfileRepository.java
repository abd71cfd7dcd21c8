package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.PlayerProfile;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PlayerProfileRepository extends JpaRepository<PlayerProfile, Long> {
}
