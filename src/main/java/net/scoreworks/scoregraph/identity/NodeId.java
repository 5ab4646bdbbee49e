/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.identity;

import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;


/**
 * Identifier of a node in the score graph. Ids are compact IRIs (e.g. {@code so:Work_M1_Measure_3}) computed
 * from the structural position of the entity, so two passes computing the same position get equal ids
 * without sharing any state. Use {@link PositionalIds} to build them.
 */
public final class NodeId implements Comparable<NodeId> {
    private final String value;

    private NodeId(String value) {
        this.value = value;
    }

    public static NodeId of(String value) {
        Validate.notBlank(value, "node id must not be blank");
        return new NodeId(value);
    }

    /**
     * @return a new id made of this id followed by the suffix
     */
    public NodeId append(String suffix) {
        return new NodeId(value + suffix);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NodeId)) {
            return false;
        }
        NodeId other = (NodeId) o;
        return this.value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(@NotNull NodeId right) {
        return value.compareTo(right.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
