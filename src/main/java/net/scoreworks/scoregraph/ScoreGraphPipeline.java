/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph;

import net.scoreworks.scoregraph.complexity.ComplexityEngine;
import net.scoreworks.scoregraph.config.ScoreGraphConfig;
import net.scoreworks.scoregraph.expression.ExpressionAttacher;
import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.metadata.MetadataBuilder;
import net.scoreworks.scoregraph.notation.NotationBuilder;
import net.scoreworks.scoregraph.structure.StructureBuilder;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * Runs a sequence of {@link ExtractionPass}es over one work and one {@link NodeStore}. Passes share nothing but
 * the store, so any subset can run in any order and a run can be repeated over its own output.
 */
public class ScoreGraphPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(ScoreGraphPipeline.class);

    private final List<ExtractionPass> passes;

    public ScoreGraphPipeline(List<ExtractionPass> passes) {
        Validate.notEmpty(passes, "a pipeline needs at least one pass");
        this.passes = Collections.unmodifiableList(new ArrayList<>(passes));
    }

    /**
     * @return all passes in data flow order: metadata, structure, notation, expression, complexity
     */
    public static ScoreGraphPipeline defaultPipeline(ScoreGraphConfig config) {
        List<ExtractionPass> passes = new ArrayList<>();
        passes.add(new MetadataBuilder());
        passes.add(new StructureBuilder());
        passes.add(new NotationBuilder());
        passes.add(new ExpressionAttacher());
        passes.add(ComplexityEngine.fromConfig(config));
        return new ScoreGraphPipeline(passes);
    }

    public List<ExtractionPass> getPasses() {
        return passes;
    }

    /**
     * Run every pass in order.
     * @param context may be null only if no pass reads the score
     * @return one report per pass
     * @throws net.scoreworks.scoregraph.exceptions.MissingStructureException before any pass ran if the score
     * has no part with measures
     */
    public List<PassReport> run(@Nullable ScoreContext context, NodeStore store) {
        boolean needsScore = false;
        for (ExtractionPass pass : passes)
            needsScore |= pass.readsScore();
        if (needsScore) {
            Validate.notNull(context, "passes reading the score need a score context");
            context.getMeasures();
        }

        List<PassReport> reports = new ArrayList<>();
        for (ExtractionPass pass : passes) {
            store.clearActivity();
            PassReport report = pass.run(context, store);
            if (report.getSkipped() > 0)
                LOG.warn("{}", report);
            else
                LOG.info("{}", report);
            reports.add(report);
        }
        store.clearActivity();
        LOG.debug("Graph holds {} node(s)", store.size());
        return reports;
    }
}
