/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.score;

import java.util.List;

public final class Part {
    private final String id;
    private final List<Measure> measures;

    public Part(String id, List<Measure> measures) {
        this.id = id;
        this.measures = List.copyOf(measures);
    }

    public String getId() {
        return id;
    }

    /**
     * @return all measures of this part in document order, regardless of movements
     */
    public List<Measure> getMeasures() {
        return measures;
    }
}
