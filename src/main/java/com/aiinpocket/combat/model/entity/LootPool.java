package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 戰利品池，適用範圍規則與 {@link SpawnPool} 相同。
 */
@Entity
@Table(name = "loot_pool", indexes = {
        @Index(name = "idx_loot_pool_location", columnList = "location_id"),
        @Index(name = "idx_loot_pool_type", columnList = "location_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LootPool {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "location_id", length = 64)
    private String locationId;

    @Column(name = "location_type", length = 50)
    private String locationType;

    @Column(name = "min_level", nullable = false)
    @Builder.Default
    private Integer minLevel = 1;

    @Column(name = "max_level", nullable = false)
    @Builder.Default
    private Integer maxLevel = 100;
}
