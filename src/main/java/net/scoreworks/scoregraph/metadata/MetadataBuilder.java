/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.metadata;

import net.scoreworks.scoregraph.ExtractionPass;
import net.scoreworks.scoregraph.PassReport;
import net.scoreworks.scoregraph.ScoreContext;
import net.scoreworks.scoregraph.graph.Node;
import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.graph.NodeType;
import net.scoreworks.scoregraph.graph.Vocabulary;
import net.scoreworks.scoregraph.identity.NodeId;
import net.scoreworks.scoregraph.identity.SubFeature;
import net.scoreworks.scoregraph.score.ScorePartwise;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Describes the work as a whole: title, composer, source file, the instrument and, if the {@link KeyEstimator}
 * of the context finds one, the global key and key signature.
 */
public class MetadataBuilder implements ExtractionPass {
    private static final Logger LOG = LoggerFactory.getLogger(MetadataBuilder.class);

    static final String DEFAULT_INSTRUMENT = "Piano";

    @Override
    public String getName() {
        return "metadata";
    }

    @Override
    public PassReport run(ScoreContext context, NodeStore store) {
        ScorePartwise score = context.getScore();
        NodeId workId = context.getIds().work();
        Node work = store.getOrCreate(workId, NodeType.MUSICAL_WORK, NodeType.SONATA, NodeType.METADATA);
        setIfPresent(work, Vocabulary.TITLE, score.getTitle());
        setIfPresent(work, Vocabulary.COMPOSER, score.getComposer());
        work.set(Vocabulary.SOURCE, score.getSource());

        String label = StringUtils.defaultIfBlank(score.getInstrumentName(), DEFAULT_INSTRUMENT);
        NodeId instrumentId = SubFeature.INSTRUMENT.of(workId);
        Node instrument = store.getOrCreate(instrumentId, instrumentClassOf(label), NodeType.METADATA);
        instrument.set(Vocabulary.LABEL, label);
        work.link(Vocabulary.HAS_INSTRUMENT, instrumentId);

        KeyEstimate key = context.getKeyEstimator().estimate(score);
        if (key == null)
            LOG.debug("No key found for {}", workId);
        else
            addKey(store, work, key);
        return PassReport.of(getName(), store, 0);
    }

    /**
     * @return {@link NodeType#PIANO} if the label names a piano, else {@link NodeType#INSTRUMENT}
     */
    static NodeType instrumentClassOf(String label) {
        return StringUtils.containsIgnoreCase(label, "piano") ? NodeType.PIANO : NodeType.INSTRUMENT;
    }

    private void addKey(NodeStore store, Node work, KeyEstimate estimate) {
        NodeId keyId = SubFeature.GLOBAL_KEY.of(work.getId());
        Node key = store.getOrCreate(keyId, NodeType.KEY, NodeType.HARMONIC_ELEMENT);
        NodeType keyClass = estimate.getKeyClass();
        if (keyClass != null)
            key.addType(keyClass);
        setIfPresent(key, Vocabulary.HAS_TONIC, estimate.getTonic());
        setIfPresent(key, Vocabulary.HAS_MODE, estimate.getMode());
        work.link(Vocabulary.HAS_KEY, keyId);

        Node signature = store.getOrCreate(SubFeature.GLOBAL_KEY_SIGNATURE.of(work.getId()),
                NodeType.KEY_SIGNATURE, NodeType.SIGNATURE, NodeType.MUSIC_NOTATION_ELEMENT, estimate.getKeySignatureClass());
        signature.set(Vocabulary.ACCIDENTAL_COUNT, estimate.getAccidentalCount());
        signature.set(Vocabulary.ACCIDENTAL_TYPE, estimate.getAccidentalType());
        signature.link(Vocabulary.REPRESENTS_KEY, keyId);
        LOG.debug("Global key of {} is {}", work.getId(), estimate);
    }

    private static void setIfPresent(Node node, String key, @Nullable Object value) {
        if (value != null)
            node.set(key, value);
    }
}
