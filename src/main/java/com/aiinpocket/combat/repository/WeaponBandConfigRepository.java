package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.WeaponBandConfig;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WeaponBandConfigRepository extends JpaRepository<WeaponBandConfig, String> {
}
