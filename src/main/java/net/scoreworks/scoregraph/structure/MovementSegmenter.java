/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.structure;

import net.scoreworks.scoregraph.score.Measure;

import java.util.List;


/**
 * Strategy that splits the flat measure sequence of a part into movements
 */
public interface MovementSegmenter {

    /**
     * @param measures all measures of the part in document order
     * @return segments in document order, numbered from 1, covering every measure from the first opening
     * position to the end. Empty only if there are no measures
     */
    List<MovementSegment> segment(List<Measure> measures);
}
