package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家在各地點的戰鬥統計。每位玩家每個地點一列。
 */
@Entity
@Table(name = "player_combat_history",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_combat_history_user_location",
                columnNames = {"user_id", "location_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerCombatHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "location_id", nullable = false, length = 64)
    private String locationId;

    @Column(name = "total_attempts", nullable = false)
    @Builder.Default
    private Integer totalAttempts = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer victories = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer defeats = 0;

    /** 目前連勝場數（戰敗歸零） */
    @Column(name = "current_streak", nullable = false)
    @Builder.Default
    private Integer currentStreak = 0;

    @Column(name = "longest_streak", nullable = false)
    @Builder.Default
    private Integer longestStreak = 0;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;
}
