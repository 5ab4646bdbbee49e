/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.structure;

import org.apache.commons.lang3.Validate;

import java.util.Objects;


/**
 * A run of consecutive measures forming one movement. Bounds are 0-based positions in the measure sequence of
 * the whole part, start inclusive and end exclusive.
 */
public final class MovementSegment {
    private final int movementIndex;
    private final int start;
    private final int end;

    public MovementSegment(int movementIndex, int start, int end) {
        Validate.isTrue(movementIndex > 0, "movement index is 1-based");
        Validate.isTrue(start >= 0 && start <= end, "invalid measure range [%d, %d)", start, end);
        this.movementIndex = movementIndex;
        this.start = start;
        this.end = end;
    }

    public int getMovementIndex() {
        return movementIndex;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int size() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MovementSegment))
            return false;
        MovementSegment other = (MovementSegment) o;
        return movementIndex == other.movementIndex && start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(movementIndex, start, end);
    }

    @Override
    public String toString() {
        return "M" + movementIndex + "[" + start + ", " + end + ")";
    }
}
