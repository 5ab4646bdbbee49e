/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.complexity;

import net.scoreworks.scoregraph.identity.NodeId;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Result of one {@link ComplexityEngine} run. Index values are rounded the way they were written to the graph
 */
public final class ComplexityProfile {
    private final ComplexityWeights weights;
    private final Map<NodeId, MeasureMetrics> metrics = new LinkedHashMap<>();
    private final Map<NodeId, Double> localIndices = new LinkedHashMap<>();
    private final Map<NodeId, Double> globalIndices = new LinkedHashMap<>();

    ComplexityProfile(ComplexityWeights weights) {
        this.weights = weights;
    }

    void putMeasure(MeasureMetrics measureMetrics, double localIndex) {
        metrics.put(measureMetrics.getMeasureId(), measureMetrics);
        localIndices.put(measureMetrics.getMeasureId(), localIndex);
    }

    void putMovement(NodeId movementId, double globalIndex) {
        globalIndices.put(movementId, globalIndex);
    }

    public ComplexityWeights getWeights() {
        return weights;
    }

    public @Nullable MeasureMetrics getMetrics(NodeId measureId) {
        return metrics.get(measureId);
    }

    /**
     * @return LCI value per measure id, in graph order
     */
    public Map<NodeId, Double> getLocalIndices() {
        return Collections.unmodifiableMap(localIndices);
    }

    /**
     * @return GCP value per movement id. Movements without measures are missing
     */
    public Map<NodeId, Double> getGlobalIndices() {
        return Collections.unmodifiableMap(globalIndices);
    }
}
