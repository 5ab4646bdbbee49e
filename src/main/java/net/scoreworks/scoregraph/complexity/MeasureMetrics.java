/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.complexity;

import net.scoreworks.scoregraph.identity.NodeId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;


/**
 * Raw metric values of one measure
 */
public final class MeasureMetrics {
    private final NodeId measureId;
    private final Map<ComplexityMetric, Integer> values = new EnumMap<>(ComplexityMetric.class);

    public MeasureMetrics(NodeId measureId) {
        this.measureId = measureId;
        for (ComplexityMetric metric : ComplexityMetric.values())
            values.put(metric, 0);
    }

    public NodeId getMeasureId() {
        return measureId;
    }

    public int get(ComplexityMetric metric) {
        return values.get(metric);
    }

    MeasureMetrics set(ComplexityMetric metric, int value) {
        values.put(metric, value);
        return this;
    }

    void increment(ComplexityMetric metric) {
        values.merge(metric, 1, Integer::sum);
    }

    public Map<ComplexityMetric, Integer> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return measureId + " " + values;
    }
}
