package com.aiinpocket.combat.support;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.random.RandomGenerator;

/**
 * 依序回傳預先排好的數值。佇列用完時回傳 fallback；沒有 fallback 則拋出例外，
 * 可用來確認某條路徑沒有擲骰。
 */
public class ScriptedRandom implements RandomGenerator {

    private final Deque<Double> doubles = new ArrayDeque<>();
    private final Deque<Integer> ints = new ArrayDeque<>();
    private final Double fallback;

    private ScriptedRandom(Double fallback) {
        this.fallback = fallback;
    }

    public static ScriptedRandom strict(double... values) {
        ScriptedRandom random = new ScriptedRandom(null);
        return random.thenDoubles(values);
    }

    public static ScriptedRandom withFallback(double fallback) {
        return new ScriptedRandom(fallback);
    }

    public ScriptedRandom thenDoubles(double... values) {
        for (double v : values) {
            doubles.add(v);
        }
        return this;
    }

    public ScriptedRandom thenInts(int... values) {
        for (int v : values) {
            ints.add(v);
        }
        return this;
    }

    public int remainingDoubles() {
        return doubles.size();
    }

    @Override
    public double nextDouble() {
        if (!doubles.isEmpty()) {
            return doubles.poll();
        }
        if (fallback == null) {
            throw new IllegalStateException("unexpected nextDouble()");
        }
        return fallback;
    }

    @Override
    public int nextInt(int bound) {
        if (!ints.isEmpty()) {
            return ints.poll();
        }
        if (fallback == null) {
            throw new IllegalStateException("unexpected nextInt()");
        }
        return 0;
    }

    @Override
    public long nextLong() {
        throw new UnsupportedOperationException("nextLong");
    }
}
