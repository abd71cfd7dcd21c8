package com.aiinpocket.combat.model.enums;

import com.aiinpocket.combat.exception.ValidationException;

import java.util.Locale;

/**
 * 轉盤命中區域，依轉盤上的固定順序排列（從 0° 起：injure → miss → graze → normal → crit）。
 *
 * <p>同一張倍率表有兩種解讀：
 * <ul>
 *   <li>攻擊時為傷害倍率（crit 另加隨機暴擊加成）</li>
 *   <li>防禦時為格擋比例：{@code clamp(0.5 × 倍率, 0, 0.8)}，crit 擋最多、injure 擋最少</li>
 * </ul>
 */
public enum HitZone {
    INJURE(-0.5),
    MISS(0.0),
    GRAZE(0.6),
    NORMAL(1.0),
    CRIT(1.6);

    private static final double BLOCK_FACTOR = 0.5;
    private static final double MAX_BLOCK = 0.8;

    private final double baseMultiplier;

    HitZone(double baseMultiplier) {
        this.baseMultiplier = baseMultiplier;
    }

    public double baseMultiplier() {
        return baseMultiplier;
    }

    /** 防禦方以此區域格擋時可抵銷的傷害比例 */
    public double blockFraction() {
        return Math.max(0.0, Math.min(MAX_BLOCK, baseMultiplier * BLOCK_FACTOR));
    }

    /**
     * 解析外部傳入的區域名稱（不分大小寫）。
     *
     * @throws ValidationException 未知的區域名稱
     */
    public static HitZone fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new ValidationException("命中區域不可為空");
        }
        try {
            return HitZone.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("未知的命中區域: " + label);
        }
    }
}
