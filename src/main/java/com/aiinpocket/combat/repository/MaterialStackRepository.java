package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.MaterialStack;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface MaterialStackRepository extends JpaRepository<MaterialStack, Long> {

    /**
     * 原子性累加既有堆疊的數量。
     *
     * @return 更新的列數；0 表示堆疊尚不存在
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE MaterialStack s SET s.quantity = s.quantity + :quantity, s.updatedAt = :now " +
            "WHERE s.userId = :userId AND s.materialId = :materialId AND s.styleId = :styleId")
    int incrementQuantity(@Param("userId") Long userId,
                          @Param("materialId") String materialId,
                          @Param("styleId") String styleId,
                          @Param("quantity") int quantity,
                          @Param("now") Instant now);
}
