package com.aiinpocket.combat.gateway;

import com.aiinpocket.combat.model.dto.LevelUpResult;

/** 玩家等級與經驗值 */
public interface ProgressionRepository {

    LevelUpResult addExperience(Long userId, long amount);

    int currentLevel(Long userId);
}
