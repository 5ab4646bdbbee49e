/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.structure;

import net.scoreworks.scoregraph.score.Measure;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.List;


/**
 * Opens a new movement at every measure whose label is exactly the start label ("1" by default). A part that
 * never uses the start label is a single movement. Pickup measures and renumbered works are not recognized.
 */
public class FirstMeasureNumberSegmenter implements MovementSegmenter {
    public static final String DEFAULT_START_LABEL = "1";

    private final String startLabel;

    public FirstMeasureNumberSegmenter() {
        this(DEFAULT_START_LABEL);
    }

    public FirstMeasureNumberSegmenter(String startLabel) {
        Validate.notEmpty(startLabel, "start label must not be empty");
        this.startLabel = startLabel;
    }

    @Override
    public List<MovementSegment> segment(List<Measure> measures) {
        List<MovementSegment> segments = new ArrayList<>();
        if (measures.isEmpty())
            return segments;

        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i < measures.size(); i++) {
            if (startLabel.equals(measures.get(i).getNumber()))
                starts.add(i);
        }
        if (starts.isEmpty()) {
            segments.add(new MovementSegment(1, 0, measures.size()));
            return segments;
        }
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : measures.size();
            segments.add(new MovementSegment(i + 1, starts.get(i), end));
        }
        return segments;
    }

    public String getStartLabel() {
        return startLabel;
    }
}
