/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph;

import net.scoreworks.scoregraph.config.ScoreGraphConfig;
import net.scoreworks.scoregraph.identity.PositionalIds;
import net.scoreworks.scoregraph.metadata.FirstKeySignatureEstimator;
import net.scoreworks.scoregraph.metadata.KeyEstimator;
import net.scoreworks.scoregraph.score.Measure;
import net.scoreworks.scoregraph.score.Part;
import net.scoreworks.scoregraph.score.ScorePartwise;
import net.scoreworks.scoregraph.structure.FirstMeasureNumberSegmenter;
import net.scoreworks.scoregraph.structure.MovementSegment;
import net.scoreworks.scoregraph.structure.MovementSegmenter;
import net.scoreworks.scoregraph.structure.PositionedMeasure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * Everything the passes read about one work: the score, the id scheme for it, the settings and the exchangeable
 * strategies. Holds no graph state.
 */
public final class ScoreContext {
    private final ScorePartwise score;
    private final ScoreGraphConfig config;
    private final PositionalIds ids;
    private final MovementSegmenter segmenter;
    private final KeyEstimator keyEstimator;

    /** computed on first use */
    private List<MovementSegment> segments;
    private List<PositionedMeasure> positionedMeasures;

    public ScoreContext(ScorePartwise score, ScoreGraphConfig config) {
        this(score, config, new FirstMeasureNumberSegmenter(config.getMovementStartLabel()),
                new FirstKeySignatureEstimator());
    }

    public ScoreContext(ScorePartwise score, ScoreGraphConfig config, MovementSegmenter segmenter,
                        KeyEstimator keyEstimator) {
        this.score = score;
        this.config = config;
        this.segmenter = segmenter;
        this.keyEstimator = keyEstimator;
        this.ids = new PositionalIds(PositionalIds.workLocalIdOf(score.getSource()),
                config.getEventOrdinalWidth(), config.getLabelFiller());
    }

    public ScorePartwise getScore() {
        return score;
    }

    public ScoreGraphConfig getConfig() {
        return config;
    }

    public PositionalIds getIds() {
        return ids;
    }

    public KeyEstimator getKeyEstimator() {
        return keyEstimator;
    }

    /**
     * @return the part all structural passes work on
     * @throws net.scoreworks.scoregraph.exceptions.MissingStructureException if it is missing or empty
     */
    public Part getPart() {
        return score.getFirstPart();
    }

    public List<Measure> getMeasures() {
        return getPart().getMeasures();
    }

    public List<MovementSegment> getSegments() {
        if (segments == null)
            segments = Collections.unmodifiableList(segmenter.segment(getMeasures()));
        return segments;
    }

    /**
     * @return every measure covered by a movement, movements in ascending order and measures in document order
     */
    public List<PositionedMeasure> getPositionedMeasures() {
        if (positionedMeasures == null) {
            List<Measure> measures = getMeasures();
            List<PositionedMeasure> result = new ArrayList<>();
            for (MovementSegment segment : getSegments()) {
                for (int i = segment.getStart(); i < segment.getEnd(); i++) {
                    Measure measure = measures.get(i);
                    int position = i + 1;
                    result.add(new PositionedMeasure(segment.getMovementIndex(), position, measure,
                            ids.measure(segment.getMovementIndex(), measure.getNumber(), position)));
                }
            }
            positionedMeasures = Collections.unmodifiableList(result);
        }
        return positionedMeasures;
    }
}
