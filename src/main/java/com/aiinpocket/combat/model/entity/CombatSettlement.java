package com.aiinpocket.combat.model.entity;

import com.aiinpocket.combat.model.enums.CombatStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 結算完成標記。
 * 所有獎勵成功發放後才寫入；存在此列即代表該場次已結算，重複領取直接回傳 rewardJson。
 */
@Entity
@Table(name = "combat_settlement",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_combat_settlement_session",
                columnNames = {"session_id"}),
        indexes = @Index(name = "idx_combat_settlement_user", columnList = "user_id, settled_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CombatSettlement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "location_id", nullable = false, length = 64)
    private String locationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CombatStatus outcome;

    /** 完整獎勵內容（JSON） */
    @Column(name = "reward_json", nullable = false, columnDefinition = "TEXT")
    private String rewardJson;

    @Column(name = "settled_at", nullable = false)
    @Builder.Default
    private Instant settledAt = Instant.now();
}
