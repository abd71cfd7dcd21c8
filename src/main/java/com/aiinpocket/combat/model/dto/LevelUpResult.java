package com.aiinpocket.combat.model.dto;

public record LevelUpResult(
        boolean leveledUp,
        int oldLevel,
        int newLevel,
        long currentExp,
        long expToNextLevel
) {}
