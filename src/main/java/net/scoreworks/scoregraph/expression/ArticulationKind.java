/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.expression;

import net.scoreworks.scoregraph.graph.NodeType;
import org.jetbrains.annotations.Nullable;


/**
 * Articulations that become graph nodes. Legato has no articulation mark of its own, it stands for the start of
 * a slur.
 */
public enum ArticulationKind {
    STACCATO("staccato", "Staccato"),
    ACCENT("accent", "Accent"),
    TENUTO("tenuto", "Tenuto"),
    LEGATO("legato", "Legato");

    private final String text;
    private final NodeType type;

    ArticulationKind(String text, String localName) {
        this.text = text;
        this.type = NodeType.so(localName);
    }

    public String getText() {
        return text;
    }

    public NodeType getType() {
        return type;
    }

    /**
     * @param tag name of an element within an articulations block, e.g. "staccato"
     * @return the kind, or null for marks without a node (staccatissimo, strong-accent...)
     */
    public static @Nullable ArticulationKind fromArticulationTag(@Nullable String tag) {
        if (tag == null)
            return null;
        String normalized = tag.trim().toLowerCase();
        for (ArticulationKind kind : values()) {
            if (kind != LEGATO && kind.text.equals(normalized))
                return kind;
        }
        return null;
    }

    /**
     * @return LEGATO for a slur start, null for any other slur type
     */
    public static @Nullable ArticulationKind fromSlurType(@Nullable String slurType) {
        return "start".equalsIgnoreCase(slurType) ? LEGATO : null;
    }
}
