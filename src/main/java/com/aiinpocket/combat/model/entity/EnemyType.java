package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 敵人模板。
 * 實際數值 = 基礎值 + 階級偏移 + 每階成長 × (階級 − 1)，見 {@link EnemyTier}。
 */
@Entity
@Table(name = "enemy_type")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnemyType {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "base_atk", nullable = false)
    private Integer baseAtk;

    @Column(name = "base_def", nullable = false)
    private Integer baseDef;

    @Column(name = "base_hp", nullable = false)
    private Integer baseHp;

    /** 每升一階增加的攻擊 */
    @Column(name = "atk_per_tier", nullable = false)
    @Builder.Default
    private Integer atkPerTier = 0;

    @Column(name = "def_per_tier", nullable = false)
    @Builder.Default
    private Integer defPerTier = 0;

    @Column(name = "hp_per_tier", nullable = false)
    @Builder.Default
    private Integer hpPerTier = 0;

    /** 攻擊精準度 0..1 */
    @Column(name = "atk_accuracy", nullable = false)
    @Builder.Default
    private Double atkAccuracy = 0.0;

    /** 防禦精準度 0..1 */
    @Column(name = "def_accuracy", nullable = false)
    @Builder.Default
    private Double defAccuracy = 0.0;
}
