/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.score;

/**
 * Child of a {@link Measure}. Measures keep their children in document order, which matters for binding
 * directions to the notes that follow them
 */
public interface MeasureElement {
}
