package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.Location;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LocationRepository extends JpaRepository<Location, String> {
}
