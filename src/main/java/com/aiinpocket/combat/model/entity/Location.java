package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 地圖地點。locationType 用來套用同類型地點共用的敵人/戰利品池（例如 forest、cave）。
 */
@Entity
@Table(name = "location", indexes = {
        @Index(name = "idx_location_type", columnList = "location_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Location {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "location_type", length = 50)
    private String locationType;
}
