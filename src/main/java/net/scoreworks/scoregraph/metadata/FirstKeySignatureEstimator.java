/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.metadata;

import net.scoreworks.scoregraph.score.Attributes;
import net.scoreworks.scoregraph.score.ScorePartwise;
import org.jetbrains.annotations.Nullable;


/**
 * Takes the first key declaration of the score as the key of the whole work
 */
public class FirstKeySignatureEstimator implements KeyEstimator {

    @Override
    public @Nullable KeyEstimate estimate(ScorePartwise score) {
        Attributes.KeyDeclaration key = score.getFirstKey();
        if (key == null || key.getFifths() == null)
            return null;
        return new KeyEstimate(key.getFifths(), key.getMode());
    }
}
