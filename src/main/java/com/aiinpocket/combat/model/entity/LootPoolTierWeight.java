package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 戰利品池依階級調整權重的倍率（未設定的階級視為 1.0）。
 */
@Entity
@Table(name = "loot_pool_tier_weight",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_loot_pool_tier",
                columnNames = {"pool_id", "tier"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LootPoolTierWeight {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_id", nullable = false)
    private LootPool pool;

    @Column(nullable = false)
    private Integer tier;

    @Column(nullable = false)
    private Double multiplier;
}
