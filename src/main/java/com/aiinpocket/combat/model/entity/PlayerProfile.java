package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家角色資料（戰鬥核心只讀取數值並寫入等級/經驗）。
 * 裝備與背包的維護由其他服務負責，這裡只保存開戰需要的裝備後數值快照。
 */
@Entity
@Table(name = "player_profile")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "display_name", length = 100)
    private String displayName;

    // ===== 成長 =====

    /** 角色等級（從 1 開始） */
    @Column(nullable = false)
    @Builder.Default
    private Integer level = 1;

    /** 累計經驗值 */
    @Column(nullable = false)
    @Builder.Default
    private Long experience = 0L;

    // ===== 裝備後數值 =====

    @Column(name = "attack", nullable = false)
    @Builder.Default
    private Integer atk = 10;

    @Column(name = "defense", nullable = false)
    @Builder.Default
    private Integer def = 5;

    @Column(nullable = false)
    @Builder.Default
    private Integer hp = 100;

    /** 命中精準度 0..1 */
    @Column(nullable = false)
    @Builder.Default
    private Double accuracy = 0.0;

    /** 已裝備武器的物品類型，null 表示空手（使用預設轉盤） */
    @Column(name = "equipped_weapon_type_id", length = 64)
    private String equippedWeaponTypeId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
