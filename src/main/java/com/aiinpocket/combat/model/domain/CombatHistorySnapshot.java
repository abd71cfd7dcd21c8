package com.aiinpocket.combat.model.domain;

/** 玩家在某地點的戰鬥統計（含連勝） */
public record CombatHistorySnapshot(
        String locationId,
        int totalAttempts,
        int victories,
        int defeats,
        int currentStreak,
        int longestStreak
) {}
