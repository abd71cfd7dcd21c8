package com.aiinpocket.combat.model.entity;

import com.aiinpocket.combat.model.enums.LootableType;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "loot_pool_drop", indexes = {
        @Index(name = "idx_loot_drop_pool", columnList = "pool_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LootPoolDrop {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_id", nullable = false)
    private LootPool pool;

    @Enumerated(EnumType.STRING)
    @Column(name = "lootable_type", nullable = false, length = 20)
    private LootableType lootableType;

    /** 素材 ID 或物品類型 ID */
    @Column(name = "lootable_id", nullable = false, length = 64)
    private String lootableId;

    @Column(nullable = false)
    private Double weight;

    @Column(nullable = false)
    @Builder.Default
    private Integer tier = 1;
}
