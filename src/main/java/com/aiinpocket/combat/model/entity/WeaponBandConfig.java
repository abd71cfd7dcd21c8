package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 武器類型的轉盤區域設定（單位：度，總和 ≤ 360）。
 */
@Entity
@Table(name = "weapon_band_config")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WeaponBandConfig {

    @Id
    @Column(name = "item_type_id", length = 64)
    private String itemTypeId;

    @Column(name = "deg_injure", nullable = false)
    private Double injure;

    @Column(name = "deg_miss", nullable = false)
    private Double miss;

    @Column(name = "deg_graze", nullable = false)
    private Double graze;

    @Column(name = "deg_normal", nullable = false)
    private Double normal;

    @Column(name = "deg_crit", nullable = false)
    private Double crit;
}
