/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Namespaces and property names of the score graph. Properties are compact IRIs and are used as keys of
 * {@link Node} properties.
 */
public final class Vocabulary {
    private Vocabulary() {}

    public static final String SO_IRI = "https://github.com/valdiviasharon/Sonata-Ontology/sonata_ontology#";
    public static final String MO_IRI = "http://purl.org/ontology/mo/";
    public static final String MTO_IRI = "http://purl.org/ontology/mto/";
    public static final String MSO_IRI = "http://linkeddata.uni-muenster.de/ontology/musicscore#";
    public static final String HO_IRI = "https://github.com/andreamust/HaMSE_Ontology/schema#";
    public static final String DCT_IRI = "http://purl.org/dc/terms/";
    public static final String RDFS_IRI = "http://www.w3.org/2000/01/rdf-schema#";

    private static final Map<String, String> DEFAULT_CONTEXT;
    static {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("so", SO_IRI);
        context.put("mo", MO_IRI);
        context.put("mto", MTO_IRI);
        context.put("mso", MSO_IRI);
        context.put("ho", HO_IRI);
        context.put("dct", DCT_IRI);
        context.put("rdfs", RDFS_IRI);
        DEFAULT_CONTEXT = Collections.unmodifiableMap(context);
    }

    /**
     * @return prefix to namespace IRI for every namespace the builders write
     */
    public static Map<String, String> defaultContext() {
        return DEFAULT_CONTEXT;
    }

    //work and metadata
    public static final String TITLE = "so:title";
    public static final String COMPOSER = "so:composer";
    public static final String SOURCE = "dct:source";
    public static final String LABEL = "rdfs:label";
    public static final String HAS_INSTRUMENT = "so:hasInstrument";
    public static final String HAS_KEY = "so:hasKey";
    public static final String HAS_TONIC = "so:hasTonic";
    public static final String HAS_MODE = "so:hasMode";
    public static final String ACCIDENTAL_COUNT = "so:accidentalCount";
    public static final String ACCIDENTAL_TYPE = "so:accidentalType";
    public static final String REPRESENTS_KEY = "so:representsKey";
    public static final String HAS_MOVEMENT = "so:hasMovement";

    //structure
    public static final String MOVEMENT_INDEX = "so:movementIndex";
    public static final String MOVEMENT_HAS_STAFF = "so:movementHasStaff";
    public static final String SONATA_MOVEMENT_HAS_PIANO_STAFF = "so:sonataMovementHasPianoStaff";
    public static final String MOVEMENT_HAS_MEASURE = "so:movementHasMeasure";
    public static final String STAFF_INDEX = "so:staffIndex";
    public static final String STAFF_HAS_MEASURE = "so:staffHasMeasure";
    public static final String STAFF_HAS_CLEF = "so:staffHasClef";
    public static final String NUMBER = "so:number";
    public static final String POSITION = "so:position";
    public static final String IS_MEASURE_OF_STAFF = "so:isMeasureOfStaff";

    //notation
    public static final String HAS_TIME_SIGNATURE = "so:hasTimeSignature";
    public static final String TIME_SIGNATURE_OF = "so:timeSignatureOf";
    public static final String NUMERATOR = "so:numerator";
    public static final String DENOMINATOR = "so:denominator";
    public static final String SYMBOL = "so:symbol";
    public static final String HAS_CLEF = "so:hasClef";
    public static final String SIGN = "so:sign";
    public static final String LINE = "so:line";
    public static final String HAS_TEMPO = "so:hasTempo";
    public static final String IS_TEMPO_OF = "so:isTempoOf";
    public static final String BPM = "so:bpm";
    public static final String TEMPO_TEXT = "so:tempoText";
    public static final String BEAT_UNIT = "so:beatUnit";
    public static final String HAS_SYMBOLIC_EVENT = "so:hasSymbolicEvent";
    public static final String IS_IN_MEASURE = "so:isInMeasure";
    public static final String HAS_DURATION = "so:hasDuration";
    public static final String NOTE_TYPE = "so:noteType";
    public static final String DOTS = "so:dots";
    public static final String HAS_PITCH = "so:hasPitch";
    public static final String OCTAVE = "so:octave";
    public static final String HAS_ACCIDENTAL = "so:hasAccidental";
    public static final String SEMITONE_SHIFT = "so:semitoneShift";

    //expression
    public static final String HAS_DYNAMIC = "so:hasDynamic";
    public static final String IS_DYNAMIC_OF = "so:isDynamicOf";
    public static final String DYNAMIC_VALUE = "so:dynamicValue";
    public static final String DYNAMIC_LEVEL = "so:dynamicLevel";
    public static final String HAS_ARTICULATION = "so:hasArticulation";
    public static final String IS_ARTICULATION_OF = "so:isArticulationOf";
    public static final String ARTICULATION_TEXT = "so:articulationText";

    //complexity
    public static final String HAS_LOCAL_COMPLEXITY_INDEX = "so:hasLocalComplexityIndex";
    public static final String LCI_VALUE = "so:LCIvalue";
    public static final String HAS_GLOBAL_COMPLEXITY_PROFILE = "so:hasGlobalComplexityProfile";
    public static final String GLOBAL_COMPLEXITY_INDEX = "so:globalComplexityIndex";
    /** Metric of an earlier LCI schema. Removed whenever an LCI node is rewritten */
    public static final String LEGACY_NOTE_DENSITY = "so:noteDensity";
}
