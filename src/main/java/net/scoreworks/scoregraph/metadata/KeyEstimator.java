/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.metadata;

import net.scoreworks.scoregraph.score.ScorePartwise;
import org.jetbrains.annotations.Nullable;


/**
 * Supplies the global key of a work. Implementations may analyse the music; the graph builders only consume the
 * result.
 */
public interface KeyEstimator {

    /**
     * @return the key, or null if none can be given
     */
    @Nullable KeyEstimate estimate(ScorePartwise score);
}
