package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 敵人出沒池。
 * locationId 指定單一地點；locationType 套用到同類型地點；兩者皆空為通用池。
 */
@Entity
@Table(name = "spawn_pool", indexes = {
        @Index(name = "idx_spawn_pool_location", columnList = "location_id"),
        @Index(name = "idx_spawn_pool_type", columnList = "location_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpawnPool {

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
