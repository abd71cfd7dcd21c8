package com.aiinpocket.combat.model.entity;

import com.aiinpocket.combat.model.enums.Rarity;
import jakarta.persistence.*;
import lombok.*;

/**
 * 物品類型定義。稀有度由類型決定，掉落時直接沿用。
 */
@Entity
@Table(name = "item_type")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemType {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    /** 物品分類（weapon / armor / accessory …） */
    @Column(nullable = false, length = 30)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Rarity rarity = Rarity.COMMON;
}
