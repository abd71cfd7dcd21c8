package com.aiinpocket.combat.service;

import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.gateway.ProgressionRepository;
import com.aiinpocket.combat.model.dto.LevelUpResult;
import com.aiinpocket.combat.model.entity.PlayerProfile;
import com.aiinpocket.combat.repository.PlayerProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressionService implements ProgressionRepository {

    private final PlayerProfileRepository profileRepo;

    /**
     * 計算升到指定等級所需的累計經驗值。
     * 公式: level * level * 50
     */
    public static long expForLevel(int level) {
        return (long) level * level * 50;
    }

    /**
     * 根據累計經驗值計算當前等級。
     */
    public static int levelForExp(long totalExp) {
        int level = 1;
        while (expForLevel(level + 1) <= totalExp) {
            level++;
        }
        return level;
    }

    /**
     * 發放經驗值，自動檢查升級。
     */
    @Override
    @Transactional
    public LevelUpResult addExperience(Long userId, long amount) {
        if (amount < 0) {
            throw new ValidationException("經驗值不可為負數: " + amount);
        }
        PlayerProfile profile = requireProfile(userId);
        int oldLevel = profile.getLevel();
        long newExp = profile.getExperience() + amount;
        profile.setExperience(newExp);

        int newLevel = Math.max(oldLevel, levelForExp(newExp));
        boolean leveledUp = newLevel > oldLevel;
        if (leveledUp) {
            profile.setLevel(newLevel);
            log.info("[成長] 用戶 {} 升級: Lv.{} → Lv.{} (EXP: {})", userId, oldLevel, newLevel, newExp);
        }
        profileRepo.save(profile);

        long expToNext = expForLevel(newLevel + 1) - newExp;
        return new LevelUpResult(leveledUp, oldLevel, newLevel, newExp, expToNext);
    }

    @Override
    @Transactional(readOnly = true)
    public int currentLevel(Long userId) {
        return requireProfile(userId).getLevel();
    }

    private PlayerProfile requireProfile(Long userId) {
        return profileRepo.findById(userId)
                .orElseThrow(() -> new NotFoundException("玩家", userId));
    }
}
