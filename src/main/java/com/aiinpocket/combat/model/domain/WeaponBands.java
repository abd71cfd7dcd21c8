package com.aiinpocket.combat.model.domain;

import com.aiinpocket.combat.exception.ValidationException;

/**
 * 武器轉盤的五段區域寬度（單位：度）。
 * 從 0° 起依 injure → miss → graze → normal → crit 排列，總和不得超過 360。
 * 未裝備武器時使用 {@link #DEFAULT}。
 */
public record WeaponBands(
        double injure,
        double miss,
        double graze,
        double normal,
        double crit
) {

    public static final double FULL_CIRCLE = 360.0;

    public static final WeaponBands DEFAULT = new WeaponBands(5, 45, 60, 200, 50);

    public WeaponBands {
        requireWidth("injure", injure);
        requireWidth("miss", miss);
        requireWidth("graze", graze);
        requireWidth("normal", normal);
        requireWidth("crit", crit);
        double total = injure + miss + graze + normal + crit;
        if (total > FULL_CIRCLE + 1e-9) {
            throw new ValidationException("武器區域總和不可超過 360°（目前 " + total + "°）");
        }
    }

    public double total() {
        return injure + miss + graze + normal + crit;
    }

    private static void requireWidth(String name, double width) {
        if (Double.isNaN(width) || Double.isInfinite(width) || width < 0) {
            throw new ValidationException("武器區域 " + name + " 寬度不合法: " + width);
        }
    }
}
