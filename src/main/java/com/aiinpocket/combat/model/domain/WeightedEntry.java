package com.aiinpocket.combat.model.domain;

/** 加權抽選的候選項目。權重 ≤ 0 或 NaN 的項目永遠不會被選中。 */
public record WeightedEntry<T>(T value, double weight) {

    public static <T> WeightedEntry<T> of(T value, double weight) {
        return new WeightedEntry<>(value, weight);
    }
}
