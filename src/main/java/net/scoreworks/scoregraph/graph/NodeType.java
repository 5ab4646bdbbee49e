/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.graph;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.Objects;


/**
 * Type tag of a graph node, written as a compact IRI ({@code prefix:LocalName}). The well known tags are
 * constants; tags that depend on content (time signature classes, pitch letters, key classes) are built with the
 * factory methods. Tags read from an input document are parsed with {@link #parse(String)}.
 */
public final class NodeType {

    //structure
    public static final NodeType MUSICAL_WORK = new NodeType("mo", "MusicalWork");
    public static final NodeType SONATA = so("Sonata");
    public static final NodeType METADATA = so("Metadata");
    public static final NodeType MOVEMENT = new NodeType("mso", "Movement");
    public static final NodeType SONATA_MOVEMENT = so("SonataMovement");
    public static final NodeType STRUCTURAL_ELEMENT = so("StructuralElement");
    public static final NodeType STAFF = new NodeType("mso", "Staff");
    public static final NodeType PIANO_STAFF = so("PianoStaff");
    public static final NodeType UPPER_PIANO_STAFF = so("UpperPianoStaff");
    public static final NodeType LOWER_PIANO_STAFF = so("LowerPianoStaff");
    public static final NodeType MEASURE = new NodeType("mso", "Measure");

    //metadata
    public static final NodeType PIANO = so("Piano");
    public static final NodeType INSTRUMENT = so("Instrument");
    public static final NodeType KEY = new NodeType("mto", "Key");
    public static final NodeType HARMONIC_ELEMENT = so("HarmonicElement");
    public static final NodeType KEY_SIGNATURE = new NodeType("mto", "KeySignature");

    //notation
    public static final NodeType MUSIC_NOTATION_ELEMENT = so("MusicNotationElement");
    public static final NodeType SIGNATURE = new NodeType("mto", "Signature");
    public static final NodeType TIME_SIGNATURE = new NodeType("mso", "TimeSignature");
    public static final NodeType CLEF = new NodeType("mso", "Clef");
    public static final NodeType TEMPO = so("Tempo");
    public static final NodeType SYMBOLIC_EVENT = new NodeType("ho", "SymbolicEvent");
    public static final NodeType NOTE = new NodeType("mso", "Note");
    public static final NodeType REST = new NodeType("mso", "Rest");
    public static final NodeType DURATION = so("Duration");
    public static final NodeType PITCH = so("Pitch");
    public static final NodeType MELODIC_ELEMENT = so("MelodicElement");
    public static final NodeType ACCIDENTAL = new NodeType("mto", "Accidental");

    //expression
    public static final NodeType DYNAMIC = new NodeType("mso", "Dynamic");
    public static final NodeType LOUDNESS_DYNAMIC = so("LoudnessDynamic");
    public static final NodeType EXPRESSIVE_ELEMENT = so("ExpressiveElement");
    public static final NodeType ARTICULATION = new NodeType("mso", "Articulation");

    //complexity
    public static final NodeType LOCAL_COMPLEXITY_INDEX = so("LocalComplexityIndex");
    public static final NodeType GLOBAL_COMPLEXITY_PROFILE = so("GlobalComplexityProfile");
    public static final NodeType TECHNICAL_COMPLEXITY_PROFILE = so("TechnicalComplexityProfile");

    private final String prefix;
    private final String localName;

    private NodeType(String prefix, String localName) {
        this.prefix = prefix;
        this.localName = localName;
    }

    public static NodeType of(String prefix, String localName) {
        Validate.notBlank(prefix, "type prefix must not be blank");
        Validate.notBlank(localName, "type name must not be blank");
        return new NodeType(prefix, localName);
    }

    /**
     * Tag within the score ontology namespace
     */
    public static NodeType so(String localName) {
        return of("so", localName);
    }

    /**
     * Parse a compact IRI. Values without a prefix are kept with an empty prefix, so they can be written back
     * unchanged.
     */
    public static NodeType parse(String compactIri) {
        Validate.notBlank(compactIri, "type must not be blank");
        String prefix = StringUtils.substringBefore(compactIri, ":");
        if (prefix.equals(compactIri) || compactIri.contains("://"))
            return new NodeType("", compactIri);
        return new NodeType(prefix, compactIri.substring(prefix.length() + 1));
    }

    /**
     * Class of a time signature, e.g. {@code so:TS_3_4}
     */
    public static NodeType timeSignatureClass(int numerator, int denominator) {
        return so("TS_" + numerator + "_" + denominator);
    }

    /**
     * Class of a pitch letter, e.g. {@code so:C}
     */
    public static NodeType pitchClass(char step) {
        return so(String.valueOf(Character.toUpperCase(step)));
    }

    public String getPrefix() {
        return prefix;
    }

    public String getLocalName() {
        return localName;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NodeType)) {
            return false;
        }
        NodeType other = (NodeType) o;
        return prefix.equals(other.prefix) && localName.equals(other.localName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, localName);
    }

    @Override
    public String toString() {
        return prefix.isEmpty() ? localName : prefix + ":" + localName;
    }
}
