/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph;

import net.scoreworks.scoregraph.graph.NodeStore;


/**
 * One step of graph construction. A pass only talks to other passes through the {@link NodeStore}: it computes
 * ids with the shared positional scheme and merges into whatever nodes already exist. Running a pass twice
 * leaves the graph as after the first run.
 */
public interface ExtractionPass {

    String getName();

    /**
     * @throws net.scoreworks.scoregraph.exceptions.MissingStructureException before writing anything if the
     * score lacks the parts or measures the pass needs
     */
    PassReport run(ScoreContext context, NodeStore store);

    /**
     * @return false for passes that work on the graph alone and need no score
     */
    default boolean readsScore() {
        return true;
    }
}
