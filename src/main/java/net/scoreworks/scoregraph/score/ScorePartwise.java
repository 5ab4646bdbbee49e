/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.score;

import net.scoreworks.scoregraph.exceptions.MissingStructureException;
import org.jetbrains.annotations.Nullable;

import java.util.List;


/**
 * A whole score as read from a document: header information and its parts. Extraction works on the first part
 */
public final class ScorePartwise {

    /** File name (or other name) of the document the score was read from. Work ids are derived from it */
    private final String source;
    private final String title;
    private final String composer;
    private final String instrumentName;
    private final List<Part> parts;

    public ScorePartwise(String source, @Nullable String title, @Nullable String composer,
                         @Nullable String instrumentName, List<Part> parts) {
        this.source = source;
        this.title = title;
        this.composer = composer;
        this.instrumentName = instrumentName;
        this.parts = List.copyOf(parts);
    }

    public String getSource() {
        return source;
    }

    public @Nullable String getTitle() {
        return title;
    }

    public @Nullable String getComposer() {
        return composer;
    }

    public @Nullable String getInstrumentName() {
        return instrumentName;
    }

    public List<Part> getParts() {
        return parts;
    }

    /**
     * @return the first part, which must contain at least one measure
     * @throws MissingStructureException if there is no part or the first part has no measures
     */
    public Part getFirstPart() {
        if (parts.isEmpty())
            throw new MissingStructureException(source, "no part found in score");
        Part part = parts.get(0);
        if (part.getMeasures().isEmpty())
            throw new MissingStructureException(source, "no measure found in part " + part.getId());
        return part;
    }

    /**
     * @return the first key declaration found in any measure of any part, or null
     */
    public @Nullable Attributes.KeyDeclaration getFirstKey() {
        for (Part part : parts) {
            for (Measure measure : part.getMeasures()) {
                for (MeasureElement element : measure.getElements()) {
                    if (element instanceof Attributes && ((Attributes) element).getKey() != null)
                        return ((Attributes) element).getKey();
                }
            }
        }
        return null;
    }
}
