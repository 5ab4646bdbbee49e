/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph;

import net.scoreworks.scoregraph.graph.NodeStore;


/**
 * What a pass did to the store: how many nodes it created, how many existing nodes it merged into, and how many
 * score elements it had to skip
 */
public final class PassReport {
    private final String passName;
    private final int created;
    private final int merged;
    private final int skipped;

    public PassReport(String passName, int created, int merged, int skipped) {
        this.passName = passName;
        this.created = created;
        this.merged = merged;
        this.skipped = skipped;
    }

    /**
     * Read the activity the store recorded since it was last cleared
     */
    public static PassReport of(String passName, NodeStore store, int skipped) {
        return new PassReport(passName, store.createdCount(), store.mergedCount(), skipped);
    }

    public String getPassName() {
        return passName;
    }

    public int getCreated() {
        return created;
    }

    public int getMerged() {
        return merged;
    }

    public int getSkipped() {
        return skipped;
    }

    @Override
    public String toString() {
        return passName + ": created=" + created + ", merged=" + merged + ", skipped=" + skipped;
    }
}
