package com.aiinpocket.combat.config;

import com.aiinpocket.combat.model.domain.WeaponBands;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "combat")
public record CombatProperties(
        Duration sessionTtl,
        boolean settleOnTerminalTurn,
        LevelParams level,
        DamageParams damage,
        AccuracyParams accuracy,
        BandParams defaultBands,
        LootParams loot,
        RewardParams reward,
        RetryParams retry
) {
    public record LevelParams(
            int min,
            int max
    ) {}

    public record DamageParams(
            int minDamage,
            double critBonusMax,
            double injureSelfMultiplier
    ) {}

    /** 精準度縮放：scale = 1 + scaleFactor × a / (a + scaleOffset) */
    public record AccuracyParams(
            double scaleFactor,
            double scaleOffset,
            double minShrinkWidth
    ) {}

    public record BandParams(
            double injure,
            double miss,
            double graze,
            double normal,
            double crit
    ) {
        public WeaponBands toBands() {
            return new WeaponBands(injure, miss, graze, normal, crit);
        }
    }

    public record LootParams(
            int maxDrops
    ) {}

    public record RewardParams(
            int goldPerLevel,
            int xpPerLevel
    ) {}

    public record RetryParams(
            int maxAttempts,
            Duration initialBackoff,
            Duration maxBackoff
    ) {}
}
