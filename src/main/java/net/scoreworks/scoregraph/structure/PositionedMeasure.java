/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.structure;

import net.scoreworks.scoregraph.identity.NodeId;
import net.scoreworks.scoregraph.score.Measure;
import org.apache.commons.lang3.StringUtils;


/**
 * A measure together with where it sits: its movement, its 1-based position in the whole part and the id that
 * position resolves to. Every pass that walks measures walks these, so they all agree on measure ids.
 */
public final class PositionedMeasure {
    private final int movementIndex;
    private final int position;
    private final Measure measure;
    private final NodeId measureId;

    public PositionedMeasure(int movementIndex, int position, Measure measure, NodeId measureId) {
        this.movementIndex = movementIndex;
        this.position = position;
        this.measure = measure;
        this.measureId = measureId;
    }

    public int getMovementIndex() {
        return movementIndex;
    }

    /**
     * @return 1-based position within all measures of the part
     */
    public int getPosition() {
        return position;
    }

    public Measure getMeasure() {
        return measure;
    }

    public NodeId getMeasureId() {
        return measureId;
    }

    /**
     * @return the label as integer if numeric, the raw label otherwise, the position if there is no label
     */
    public Object getNumberValue() {
        String label = measure.getNumber();
        if (StringUtils.isEmpty(label))
            return position;
        try {
            return Integer.parseInt(label.trim());
        } catch (NumberFormatException e) {
            return label;
        }
    }

    @Override
    public String toString() {
        return measureId.toString();
    }
}
