/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.complexity;


/**
 * The raw per-measure counters a {@link ComplexityEngine} combines into the local complexity index. The order of
 * the constants is the order in which they are written to an LCI node.
 */
public enum ComplexityMetric {
    NOTE_COUNT("noteCount", 3.06),
    MEASURE_ACCIDENTAL_COUNT("measureAccidentalCount", 4.31),
    SUBDIVISION_INDEX("subdivisionIndex", 3.75),
    MIN_NOTE_VALUE("minNoteValue", 3.68),
    DYNAMIC_COUNT("dynamicCount", 3.68),
    ARTICULATION_COUNT("articulationCount", 4.43);

    private final String key;
    private final double defaultWeight;

    ComplexityMetric(String key, double defaultWeight) {
        this.key = key;
        this.defaultWeight = defaultWeight;
    }

    /**
     * @return name used for configuration keys, e.g. "noteCount"
     */
    public String getKey() {
        return key;
    }

    /**
     * @return the graph property holding the raw value, e.g. "so:noteCount"
     */
    public String getProperty() {
        return "so:" + key;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }
}
