package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.config.CombatProperties;
import com.aiinpocket.combat.model.enums.HitZone;
import org.springframework.stereotype.Component;

import java.util.random.RandomGenerator;

/**
 * 傷害與防禦計算（雙方共用同一套公式）。
 *
 * <ul>
 *   <li>graze / normal / crit：{@code max(MIN_DAMAGE, floor(atk × 倍率 − def))}，crit 倍率另加暴擊加成</li>
 *   <li>miss：未接觸，傷害 0</li>
 *   <li>injure：對目標無傷害，攻擊方自傷 {@code 2 × max(MIN_DAMAGE, floor(atk × 0.5))}</li>
 * </ul>
 * 防禦區域依 {@link HitZone#blockFraction()} 抵銷傷害，有傷害時至少保留 MIN_DAMAGE。
 */
@Component
public class DamageCalculator {

    private static final double FLOOR_EPSILON = 1e-9;

    private final int minDamage;
    private final double critBonusMax;
    private final double injureSelfMultiplier;

    public DamageCalculator(CombatProperties props) {
        this.minDamage = props.damage().minDamage();
        this.critBonusMax = props.damage().critBonusMax();
        this.injureSelfMultiplier = props.damage().injureSelfMultiplier();
    }

    public int attackDamage(int atk, int def, HitZone zone, double critBonus) {
        return switch (zone) {
            case MISS, INJURE -> 0;
            case GRAZE, NORMAL -> Math.max(minDamage, floorDamage(atk * zone.baseMultiplier() - def));
            case CRIT -> Math.max(minDamage, floorDamage(atk * (zone.baseMultiplier() + critBonus) - def));
        };
    }

    public int injureSelfDamage(int atk) {
        return 2 * Math.max(minDamage, floorDamage(atk * injureSelfMultiplier));
    }

    public int applyDefense(int incoming, HitZone defenseZone) {
        if (incoming <= 0) {
            return 0;
        }
        return Math.max(minDamage, floorDamage(incoming * (1 - defenseZone.blockFraction())));
    }

    // 倍率相乘的浮點誤差（例如 100 × 0.2 = 19.999…）不應少扣 1 點
    private static int floorDamage(double value) {
        return (int) Math.floor(value + FLOOR_EPSILON);
    }

    /** 暴擊加成，範圍 [0, critBonusMax) */
    public double rollCritBonus(RandomGenerator random) {
        return critBonusMax <= 0 ? 0 : random.nextDouble() * critBonusMax;
    }
}
