package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.model.domain.WeightedEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * 加權不重複抽選。
 *
 * <p>每次抽選依剩餘項目的權重比例決定（累積權重法），抽中的項目移出候選清單。
 * 權重 ≤ 0 或 NaN 的項目直接排除；候選不足時回傳全部可選項目。
 * 同權重時依輸入順序決定（累積區間採嚴格小於判斷）。
 */
public final class WeightedSelector {

    private WeightedSelector() {
    }

    public static <T> List<T> select(List<WeightedEntry<T>> entries, int count, RandomGenerator random) {
        if (count < 0) {
            throw new IllegalArgumentException("count 不可為負數: " + count);
        }
        if (entries == null || entries.isEmpty() || count == 0) {
            return List.of();
        }

        List<WeightedEntry<T>> pool = new ArrayList<>(entries.size());
        double totalWeight = 0;
        for (WeightedEntry<T> entry : entries) {
            if (isSelectable(entry.weight())) {
                pool.add(entry);
                totalWeight += entry.weight();
            }
        }

        List<T> picked = new ArrayList<>(Math.min(count, pool.size()));
        while (picked.size() < count && !pool.isEmpty()) {
            double r = random.nextDouble() * totalWeight;
            int index = indexOf(pool, r);
            WeightedEntry<T> chosen = pool.remove(index);
            totalWeight -= chosen.weight();
            picked.add(chosen.value());
        }
        return picked;
    }

    public static <T> T selectOne(List<WeightedEntry<T>> entries, RandomGenerator random) {
        List<T> picked = select(entries, 1, random);
        return picked.isEmpty() ? null : picked.get(0);
    }

    private static <T> int indexOf(List<WeightedEntry<T>> pool, double r) {
        double cumulative = 0;
        for (int i = 0; i < pool.size(); i++) {
            cumulative += pool.get(i).weight();
            if (r < cumulative) {
                return i;
            }
        }
        // 浮點誤差時 r 可能等於總和
        return pool.size() - 1;
    }

    private static boolean isSelectable(double weight) {
        return !Double.isNaN(weight) && !Double.isInfinite(weight) && weight > 0;
    }
}
