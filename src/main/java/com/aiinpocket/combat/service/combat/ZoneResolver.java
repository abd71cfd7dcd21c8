package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.config.CombatProperties;
import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.model.domain.WeaponBands;
import com.aiinpocket.combat.model.enums.HitZone;
import org.springframework.stereotype.Component;

import java.util.random.RandomGenerator;

/**
 * 轉盤區域判定。
 *
 * <p>精準度越高，injure 與 miss 區域越窄：
 * <pre>
 *   scale   = 1 + scaleFactor × a / (a + scaleOffset)
 *   injure' = min(injure, max(injure / scale, minShrinkWidth))   miss 同理
 * </pre>
 * 縮減出來的度數依 graze / normal / crit 原寬度比例分配，總和不變。
 * 區域由 0° 起依固定順序排列，總和未滿 360° 時剩餘的弧度視為 miss。
 */
@Component
public class ZoneResolver {

    private final CombatProperties.AccuracyParams accuracyParams;
    private final WeaponBands defaultBands;

    public ZoneResolver(CombatProperties props) {
        this.accuracyParams = props.accuracy();
        this.defaultBands = props.defaultBands().toBands();
    }

    /** 依精準度調整區域寬度 */
    public WeaponBands scaleBands(WeaponBands bands, double accuracy) {
        requireAccuracy(accuracy);
        double scale = 1 + accuracyParams.scaleFactor() * accuracy / (accuracy + accuracyParams.scaleOffset());

        double injure = shrink(bands.injure(), scale);
        double miss = shrink(bands.miss(), scale);
        double freed = (bands.injure() - injure) + (bands.miss() - miss);
        double expandPool = bands.graze() + bands.normal() + bands.crit();
        if (freed <= 0 || expandPool <= 0) {
            return bands;
        }

        return new WeaponBands(
                injure,
                miss,
                bands.graze() + freed * bands.graze() / expandPool,
                bands.normal() + freed * bands.normal() / expandPool,
                bands.crit() + freed * bands.crit() / expandPool);
    }

    /**
     * 判定點擊角度落在哪個區域。
     *
     * @throws ValidationException 角度不在 [0, 360) 或精準度不在 [0, 1]
     */
    public HitZone resolve(double degrees, WeaponBands bands, double accuracy) {
        requireDegrees(degrees);
        return zoneAt(degrees, scaleBands(bands, accuracy));
    }

    /** 敵方擲骰：在預設轉盤上隨機取一個角度，依敵方精準度判定 */
    public HitZone roll(double accuracy, RandomGenerator random) {
        double degrees = random.nextDouble() * WeaponBands.FULL_CIRCLE;
        return resolve(degrees, defaultBands, accuracy);
    }

    public WeaponBands defaultBands() {
        return defaultBands;
    }

    static HitZone zoneAt(double degrees, WeaponBands bands) {
        double edge = bands.injure();
        if (degrees < edge) return HitZone.INJURE;
        edge += bands.miss();
        if (degrees < edge) return HitZone.MISS;
        edge += bands.graze();
        if (degrees < edge) return HitZone.GRAZE;
        edge += bands.normal();
        if (degrees < edge) return HitZone.NORMAL;
        edge += bands.crit();
        if (degrees < edge) return HitZone.CRIT;
        return HitZone.MISS;
    }

    private double shrink(double width, double scale) {
        return Math.min(width, Math.max(width / scale, accuracyParams.minShrinkWidth()));
    }

    private static void requireDegrees(double degrees) {
        if (Double.isNaN(degrees) || degrees < 0 || degrees >= WeaponBands.FULL_CIRCLE) {
            throw new ValidationException("點擊角度必須介於 [0, 360): " + degrees);
        }
    }

    private static void requireAccuracy(double accuracy) {
        if (Double.isNaN(accuracy) || accuracy < 0 || accuracy > 1) {
            throw new ValidationException("精準度必須介於 0 與 1 之間: " + accuracy);
        }
    }
}
