package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.LootPoolDrop;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface LootPoolDropRepository extends JpaRepository<LootPoolDrop, Long> {

    @Query("SELECT d FROM LootPoolDrop d JOIN FETCH d.pool WHERE d.pool.id IN :poolIds ORDER BY d.pool.id, d.id")
    List<LootPoolDrop> findByPoolIds(@Param("poolIds") Collection<String> poolIds);
}
