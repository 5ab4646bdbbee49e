/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.score;

import org.jetbrains.annotations.Nullable;

/**
 * Playback hint of a measure or direction. Only the tempo attribute is of interest
 */
public final class Sound implements MeasureElement {
    private final String tempo;

    public Sound(@Nullable String tempo) {
        this.tempo = tempo;
    }

    public @Nullable String getTempo() {
        return tempo;
    }
}
