package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 敵人階級。提供各數值的固定偏移，以及勝利金幣/經驗倍率。
 */
@Entity
@Table(name = "enemy_tier")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnemyTier {

    @Id
    @Column(name = "tier_num")
    private Integer tierNum;

    @Column(name = "atk_offset", nullable = false)
    @Builder.Default
    private Integer atkOffset = 0;

    @Column(name = "def_offset", nullable = false)
    @Builder.Default
    private Integer defOffset = 0;

    @Column(name = "hp_offset", nullable = false)
    @Builder.Default
    private Integer hpOffset = 0;

    @Column(name = "gold_multiplier", nullable = false)
    @Builder.Default
    private Double goldMultiplier = 1.0;

    @Column(name = "xp_multiplier", nullable = false)
    @Builder.Default
    private Double xpMultiplier = 1.0;
}
