/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.complexity;

import net.scoreworks.scoregraph.config.ScoreGraphConfig;
import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;


/**
 * Normalized metric weights. Negative raw weights count as zero, the remaining ones are scaled to sum up to 1.
 * If no raw weight is positive, every metric gets the same share.
 */
public final class ComplexityWeights {
    private final Map<ComplexityMetric, Double> weights;

    private ComplexityWeights(Map<ComplexityMetric, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static ComplexityWeights defaults() {
        Map<ComplexityMetric, Double> raw = new EnumMap<>(ComplexityMetric.class);
        for (ComplexityMetric metric : ComplexityMetric.values())
            raw.put(metric, metric.getDefaultWeight());
        return normalize(raw);
    }

    public static ComplexityWeights fromConfig(ScoreGraphConfig config) {
        Map<ComplexityMetric, Double> raw = new EnumMap<>(ComplexityMetric.class);
        for (ComplexityMetric metric : ComplexityMetric.values())
            raw.put(metric, config.getWeight(metric));
        return normalize(raw);
    }

    /**
     * @param raw weight per metric; metrics without an entry weigh zero
     */
    public static ComplexityWeights normalize(Map<ComplexityMetric, Double> raw) {
        Validate.notNull(raw);
        double sum = 0;
        for (ComplexityMetric metric : ComplexityMetric.values())
            sum += clamp(raw.get(metric));

        Map<ComplexityMetric, Double> normalized = new EnumMap<>(ComplexityMetric.class);
        int metricCount = ComplexityMetric.values().length;
        for (ComplexityMetric metric : ComplexityMetric.values()) {
            normalized.put(metric, sum <= 0 ? 1.0 / metricCount : clamp(raw.get(metric)) / sum);
        }
        return new ComplexityWeights(normalized);
    }

    private static double clamp(Double weight) {
        return weight == null || weight.isNaN() ? 0 : Math.max(weight, 0);
    }

    public double get(ComplexityMetric metric) {
        return weights.get(metric);
    }

    public Map<ComplexityMetric, Double> asMap() {
        return weights;
    }

    /**
     * @return sum of all normalized weights, 1 up to rounding
     */
    public double sum() {
        double sum = 0;
        for (double w : weights.values())
            sum += w;
        return sum;
    }

    @Override
    public String toString() {
        return "ComplexityWeights" + weights;
    }
}
