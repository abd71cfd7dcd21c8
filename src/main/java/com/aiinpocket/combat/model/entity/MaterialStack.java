package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家的素材堆疊。同一用戶、同一素材、同一風格只會有一列，數量以 upsert 累加。
 */
@Entity
@Table(name = "material_stack",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_material_stack",
                columnNames = {"user_id", "material_id", "style_id"}),
        indexes = @Index(name = "idx_material_stack_user", columnList = "user_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MaterialStack {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "material_id", nullable = false, length = 64)
    private String materialId;

    @Column(name = "style_id", nullable = false, length = 64)
    private String styleId;

    @Column(nullable = false)
    @Builder.Default
    private Integer quantity = 0;

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();
}
