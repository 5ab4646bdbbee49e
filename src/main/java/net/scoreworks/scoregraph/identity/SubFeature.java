/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.identity;


/**
 * Entities that have no position of their own and are named after their parent node by appending a fixed suffix.
 * Indexed features (several per parent) additionally append a 1-based number.
 */
public enum SubFeature {
    DURATION("_Dur", false),
    PITCH("_Pitch", false),
    ACCIDENTAL("_Accidental", false),
    TIME_SIGNATURE("_TimeSig", false),
    CLEF("_Clef", false),
    LOCAL_COMPLEXITY_INDEX("_LCI", false),
    GLOBAL_COMPLEXITY_PROFILE("_GCP", false),
    INSTRUMENT("_Instrument", false),
    GLOBAL_KEY("_GlobalKey", false),
    GLOBAL_KEY_SIGNATURE("_GlobalKeySignature", false),
    DYNAMIC("_Dyn_", true),
    ARTICULATION("_Art_", true),
    TEMPO("_Tempo_", true);

    private final String suffix;
    private final boolean indexed;

    SubFeature(String suffix, boolean indexed) {
        this.suffix = suffix;
        this.indexed = indexed;
    }

    public boolean isIndexed() {
        return indexed;
    }

    /**
     * @param parent id of the owning node
     * @return id of this feature of the parent
     */
    public NodeId of(NodeId parent) {
        if (indexed)
            throw new IllegalStateException(name() + " needs an index");
        return parent.append(suffix);
    }

    /**
     * @param parent id of the owning node
     * @param index 1-based number of the feature within its parent
     * @return id of the index-th feature of the parent
     */
    public NodeId of(NodeId parent, int index) {
        if (!indexed)
            throw new IllegalStateException(name() + " is not indexed");
        if (index < 1)
            throw new IllegalArgumentException("feature index must be 1-based but was " + index);
        return parent.append(suffix + index);
    }
}
