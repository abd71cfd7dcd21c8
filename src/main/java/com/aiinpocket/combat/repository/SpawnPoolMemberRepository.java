package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.SpawnPoolMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface SpawnPoolMemberRepository extends JpaRepository<SpawnPoolMember, Long> {

    @Query("SELECT m FROM SpawnPoolMember m JOIN FETCH m.pool WHERE m.pool.id IN :poolIds ORDER BY m.pool.id, m.id")
    List<SpawnPoolMember> findByPoolIds(@Param("poolIds") Collection<String> poolIds);
}
