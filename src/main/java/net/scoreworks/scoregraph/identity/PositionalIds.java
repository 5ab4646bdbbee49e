/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.identity;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;


/**
 * Maps the structural position of an entity within one work to its {@link NodeId}. This is the only place where
 * ids are spelled out: every extraction pass calls into it, and passes agree on a node exactly when they compute
 * the same position. Instances are immutable and hold no traversal state.
 *
 * <pre>
 * so:&lt;work&gt;
 * so:&lt;work&gt;_M&lt;movement&gt;
 * so:&lt;work&gt;_M&lt;movement&gt;_Staff_&lt;staff&gt;
 * so:&lt;work&gt;_M&lt;movement&gt;_Measure_&lt;label&gt;
 * so:&lt;work&gt;_M&lt;movement&gt;_Measure_&lt;label&gt;_Event_&lt;ordinal&gt;
 * </pre>
 */
public final class PositionalIds {
    public static final String PREFIX = "so:";
    public static final int DEFAULT_ORDINAL_WIDTH = 6;
    public static final char DEFAULT_LABEL_FILLER = '_';

    private final String workLocalId;
    private final int ordinalWidth;
    private final char labelFiller;

    public PositionalIds(String workLocalId) {
        this(workLocalId, DEFAULT_ORDINAL_WIDTH, DEFAULT_LABEL_FILLER);
    }

    public PositionalIds(String workLocalId, int ordinalWidth, char labelFiller) {
        Validate.notBlank(workLocalId, "work id must not be blank");
        Validate.isTrue(ordinalWidth > 0, "ordinal width must be positive");
        this.workLocalId = workLocalId;
        this.ordinalWidth = ordinalWidth;
        this.labelFiller = labelFiller;
    }

    /**
     * @param source path or file name of the source document
     * @return the local work id, which is the base name of the source without its extension
     */
    public static String workLocalIdOf(String source) {
        Path fileName = Path.of(source).getFileName();
        String baseName = fileName == null ? source : fileName.toString();
        int dot = baseName.lastIndexOf('.');
        return dot > 0 ? baseName.substring(0, dot) : baseName;
    }

    public String getWorkLocalId() {
        return workLocalId;
    }

    public NodeId work() {
        return NodeId.of(PREFIX + workLocalId);
    }

    public NodeId movement(int movementIndex) {
        return NodeId.of(PREFIX + workLocalId + "_M" + movementIndex);
    }

    public NodeId staff(int movementIndex, int staffIndex) {
        return movement(movementIndex).append("_Staff_" + staffIndex);
    }

    /**
     * Clefs are kept once per staff and movement, not per measure
     */
    public NodeId staffClef(int movementIndex, int staffIndex) {
        return SubFeature.CLEF.of(staff(movementIndex, staffIndex));
    }

    /**
     * @param rawLabel the measure label as written in the score, may be absent
     * @param position 1-based position of the measure within the whole (unsegmented) measure sequence
     */
    public NodeId measure(int movementIndex, @Nullable String rawLabel, int position) {
        return movement(movementIndex).append("_Measure_" + sanitizeLabel(rawLabel, position));
    }

    public NodeId event(NodeId measureId, int ordinal) {
        Validate.isTrue(ordinal > 0, "event ordinals are 1-based");
        return measureId.append("_Event_" + StringUtils.leftPad(Integer.toString(ordinal), ordinalWidth, '0'));
    }

    public NodeId event(int movementIndex, @Nullable String rawLabel, int position, int ordinal) {
        return event(measure(movementIndex, rawLabel, position), ordinal);
    }

    /**
     * Replace every character that is not a letter or digit with the filler. An empty or absent label is
     * replaced by the position of the measure.
     */
    public String sanitizeLabel(@Nullable String rawLabel, int position) {
        String label = StringUtils.isEmpty(rawLabel) ? Integer.toString(position) : rawLabel;
        StringBuilder strb = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            strb.append(Character.isLetterOrDigit(c) ? c : labelFiller);
        }
        return strb.toString();
    }

    @Override
    public String toString() {
        return "PositionalIds[" + workLocalId + "]";
    }
}
