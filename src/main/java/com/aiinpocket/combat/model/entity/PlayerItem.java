package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家持有的物品實例（戰鬥掉落時建立）。
 */
@Entity
@Table(name = "player_item", indexes = {
        @Index(name = "idx_player_item_user", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "item_type_id", nullable = false, length = 64)
    private String itemTypeId;

    @Column(name = "item_level", nullable = false)
    @Builder.Default
    private Integer level = 1;

    /** 掉落時繼承的敵人風格 */
    @Column(name = "style_id", nullable = false, length = 64)
    @Builder.Default
    private String styleId = "normal";

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
