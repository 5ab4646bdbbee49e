/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.score;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;


/**
 * A measure as read from the score: its label and its children in document order
 */
public final class Measure {

    /**
     * Label as written in the score (MusicXML {@code number} attribute). Not necessarily numeric and may be absent
     */
    private final String number;

    private final List<MeasureElement> elements;

    public Measure(@Nullable String number, List<MeasureElement> elements) {
        this.number = number;
        this.elements = List.copyOf(elements);
    }

    public @Nullable String getNumber() {
        return number;
    }

    public List<MeasureElement> getElements() {
        return elements;
    }

    /**
     * @return every attributes block in document order. Clef changes within a measure come as further blocks
     */
    public List<Attributes> getAttributeBlocks() {
        return elementsOf(Attributes.class);
    }

    public List<Note> getNotes() {
        return elementsOf(Note.class);
    }

    public List<Direction> getDirections() {
        return elementsOf(Direction.class);
    }

    /**
     * @return sound elements that are direct children of the measure (not those nested in directions)
     */
    public List<Sound> getSounds() {
        return elementsOf(Sound.class);
    }

    private <T extends MeasureElement> List<T> elementsOf(Class<T> clazz) {
        List<T> result = new ArrayList<>();
        for (MeasureElement element : elements) {
            if (clazz.isInstance(element))
                result.add(clazz.cast(element));
        }
        return result;
    }
}
