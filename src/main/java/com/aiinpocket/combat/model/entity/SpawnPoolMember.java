package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "spawn_pool_member", indexes = {
        @Index(name = "idx_spawn_member_pool", columnList = "pool_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpawnPoolMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_id", nullable = false)
    private SpawnPool pool;

    @Column(name = "enemy_type_id", nullable = false, length = 64)
    private String enemyTypeId;

    @Column(nullable = false)
    private Double weight;

    @Column(nullable = false)
    @Builder.Default
    private Integer tier = 1;

    /** 外觀風格，null 表示 normal */
    @Column(name = "style_id", length = 64)
    private String styleId;
}
