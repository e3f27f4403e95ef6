package com.frameworkbench.platform.benchmark.scenario;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Picks items with fixed relative weights.
 */
public final class WeightedChoice<T> {

    private final List<T> items;
    private final double[] cumulative;
    private final double total;

    private WeightedChoice(List<T> items, double[] cumulative) {
        this.items = List.copyOf(items);
        this.cumulative = cumulative;
        this.total = cumulative[cumulative.length - 1];
    }

    public T pick(SplittableRandom random) {
        double r = random.nextDouble() * total;
        for (int i = 0; i < cumulative.length; i++) {
            if (r < cumulative[i]) return items.get(i);
        }
        return items.get(items.size() - 1);
    }

    public List<T> items() {
        return items;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static final class Builder<T> {
        private final List<T> items = new ArrayList<>();
        private final List<Double> weights = new ArrayList<>();

        public Builder<T> add(double weight, T item) {
            if (weight <= 0) {
                throw new IllegalArgumentException("weight must be positive: " + weight);
            }
            items.add(item);
            weights.add(weight);
            return this;
        }

        public WeightedChoice<T> build() {
            if (items.isEmpty()) {
                throw new IllegalStateException("at least one weighted item is required");
            }
            double[] cumulative = new double[weights.size()];
            double sum = 0;
            for (int i = 0; i < weights.size(); i++) {
                sum += weights.get(i);
                cumulative[i] = sum;
            }
            return new WeightedChoice<>(items, cumulative);
        }
    }
}
