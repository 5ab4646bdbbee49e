/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.complexity;

import net.scoreworks.scoregraph.ExtractionPass;
import net.scoreworks.scoregraph.PassReport;
import net.scoreworks.scoregraph.ScoreContext;
import net.scoreworks.scoregraph.config.ScoreGraphConfig;
import net.scoreworks.scoregraph.expression.ArticulationKind;
import net.scoreworks.scoregraph.graph.Node;
import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.graph.NodeType;
import net.scoreworks.scoregraph.graph.Vocabulary;
import net.scoreworks.scoregraph.identity.NodeId;
import net.scoreworks.scoregraph.identity.SubFeature;
import net.scoreworks.scoregraph.notation.NoteType;
import org.apache.commons.collections4.multimap.ArrayListValuedHashMap;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Computes the technical complexity of a finished graph.
 * <ol>
 *     <li>six raw counters per measure, see {@link ComplexityMetric}</li>
 *     <li>min-max normalization of every counter over all measures of the graph. A counter with the same value
 *     everywhere normalizes to 0</li>
 *     <li>the weighted sum of the normalized counters is the local complexity index (LCI) of the measure</li>
 *     <li>the mean LCI of the measures of a movement is its global complexity index (GCP)</li>
 * </ol>
 * LCI and GCP nodes are rewritten on every run. Works only on the graph, so it can run on a loaded document
 * without the score.
 */
public class ComplexityEngine implements ExtractionPass {
    private static final Logger LOG = LoggerFactory.getLogger(ComplexityEngine.class);

    private final ComplexityWeights weights;
    private final int defaultBeatDenominator;
    private final int decimalPlaces;

    public ComplexityEngine() {
        this(ComplexityWeights.defaults(), 4, 4);
    }

    public ComplexityEngine(ComplexityWeights weights, int defaultBeatDenominator, int decimalPlaces) {
        Validate.isTrue(decimalPlaces >= 0, "decimal places must not be negative");
        this.weights = weights;
        this.defaultBeatDenominator = defaultBeatDenominator;
        this.decimalPlaces = decimalPlaces;
    }

    public static ComplexityEngine fromConfig(ScoreGraphConfig config) {
        return new ComplexityEngine(ComplexityWeights.fromConfig(config), config.getDefaultBeatDenominator(),
                config.getDecimalPlaces());
    }

    @Override
    public String getName() {
        return "complexity";
    }

    @Override
    public boolean readsScore() {
        return false;
    }

    @Override
    public PassReport run(@Nullable ScoreContext context, NodeStore store) {
        compute(store);
        return PassReport.of(getName(), store, 0);
    }

    public ComplexityProfile compute(NodeStore store) {
        List<Node> measures = store.nodesOfType(NodeType.MEASURE);
        Map<NodeId, MeasureMetrics> metrics = collectMetrics(store, measures);

        //min and max of each metric over all measures
        Map<ComplexityMetric, Integer> min = new EnumMap<>(ComplexityMetric.class);
        Map<ComplexityMetric, Integer> max = new EnumMap<>(ComplexityMetric.class);
        for (MeasureMetrics m : metrics.values()) {
            for (ComplexityMetric metric : ComplexityMetric.values()) {
                min.merge(metric, m.get(metric), Integer::min);
                max.merge(metric, m.get(metric), Integer::max);
            }
        }

        ComplexityProfile profile = new ComplexityProfile(weights);
        Map<NodeId, Double> unrounded = new HashMap<>();
        for (Node measure : measures) {
            MeasureMetrics m = metrics.get(measure.getId());
            double lci = 0;
            for (ComplexityMetric metric : ComplexityMetric.values())
                lci += weights.get(metric) * normalize(m.get(metric), min.get(metric), max.get(metric));
            unrounded.put(measure.getId(), lci);
            double rounded = round(lci, decimalPlaces);
            writeLocalIndex(store, measure, m, rounded);
            profile.putMeasure(m, rounded);
        }

        for (Node movement : store.nodesOfType(NodeType.SONATA_MOVEMENT)) {
            List<Double> values = new ArrayList<>();
            for (NodeId measureId : movement.getLinks(Vocabulary.MOVEMENT_HAS_MEASURE)) {
                Double lci = unrounded.get(measureId);
                if (lci != null)
                    values.add(lci);
            }
            if (values.isEmpty()) {
                LOG.debug("No measure with a complexity index in {}", movement.getId());
                continue;
            }
            double gcp = round(mean(values), decimalPlaces);
            NodeId gcpId = SubFeature.GLOBAL_COMPLEXITY_PROFILE.of(movement.getId());
            Node gcpNode = store.getOrCreate(gcpId, NodeType.GLOBAL_COMPLEXITY_PROFILE, NodeType.TECHNICAL_COMPLEXITY_PROFILE);
            gcpNode.set(Vocabulary.GLOBAL_COMPLEXITY_INDEX, gcp);
            movement.link(Vocabulary.HAS_GLOBAL_COMPLEXITY_PROFILE, gcpId);
            profile.putMovement(movement.getId(), gcp);
        }
        LOG.debug("Complexity of {} measure(s) and {} movement(s) computed", measures.size(), profile.getGlobalIndices().size());
        return profile;
    }

    private void writeLocalIndex(NodeStore store, Node measure, MeasureMetrics metrics, double value) {
        NodeId lciId = SubFeature.LOCAL_COMPLEXITY_INDEX.of(measure.getId());
        Node lci = store.getOrCreate(lciId, NodeType.LOCAL_COMPLEXITY_INDEX, NodeType.TECHNICAL_COMPLEXITY_PROFILE);
        lci.remove(Vocabulary.LEGACY_NOTE_DENSITY);
        for (ComplexityMetric metric : ComplexityMetric.values())
            lci.set(metric.getProperty(), metrics.get(metric));
        lci.set(Vocabulary.LCI_VALUE, value);
        measure.link(Vocabulary.HAS_LOCAL_COMPLEXITY_INDEX, lciId);
    }


    //==========RAW METRICS====================================================

    private Map<NodeId, MeasureMetrics> collectMetrics(NodeStore store, List<Node> measures) {
        Map<NodeId, MeasureMetrics> metrics = new LinkedHashMap<>();
        for (Node measure : measures)
            metrics.put(measure.getId(), new MeasureMetrics(measure.getId()));

        //events are assigned to measures by their own isInMeasure reference
        Map<NodeId, NodeId> measureOfEvent = new HashMap<>();
        ArrayListValuedHashMap<NodeId, Node> notesOfMeasure = new ArrayListValuedHashMap<>();
        for (Node event : store.nodesOfType(NodeType.SYMBOLIC_EVENT)) {
            NodeId measureId = event.getLink(Vocabulary.IS_IN_MEASURE);
            if (measureId == null)
                continue;
            measureOfEvent.put(event.getId(), measureId);
            if (event.hasType(NodeType.NOTE))
                notesOfMeasure.put(measureId, event);
        }

        for (Node dynamic : store.nodesOfType(NodeType.LOUDNESS_DYNAMIC))
            countFor(metrics, measureOfEvent, dynamic.getLink(Vocabulary.IS_DYNAMIC_OF), ComplexityMetric.DYNAMIC_COUNT);
        for (Node articulation : store.nodesOfType(ArticulationKind.STACCATO.getType()))
            countFor(metrics, measureOfEvent, articulation.getLink(Vocabulary.IS_ARTICULATION_OF), ComplexityMetric.ARTICULATION_COUNT);

        for (Node measure : measures) {
            MeasureMetrics m = metrics.get(measure.getId());
            int beatDenominator = beatDenominatorOf(store, measure);
            List<Node> notes = notesOfMeasure.get(measure.getId());
            int accidentals = 0;
            int minNoteValue = 0;
            int subdivision = 0;
            for (Node note : notes) {
                Node pitch = store.resolveFirst(note, Vocabulary.HAS_PITCH);
                if (pitch != null && pitch.has(Vocabulary.HAS_ACCIDENTAL))
                    accidentals++;
                int base = baseDenominatorOf(store, note);
                if (base <= 0)
                    continue;
                minNoteValue = Math.max(minNoteValue, base);
                subdivision = Math.max(subdivision, subdivision(base, beatDenominator));
            }
            m.set(ComplexityMetric.NOTE_COUNT, notes.size())
                    .set(ComplexityMetric.MEASURE_ACCIDENTAL_COUNT, accidentals)
                    .set(ComplexityMetric.MIN_NOTE_VALUE, minNoteValue)
                    .set(ComplexityMetric.SUBDIVISION_INDEX, subdivision);
        }
        return metrics;
    }

    private static void countFor(Map<NodeId, MeasureMetrics> metrics, Map<NodeId, NodeId> measureOfEvent,
                                 @Nullable NodeId eventId, ComplexityMetric metric) {
        if (eventId == null)
            return;
        NodeId measureId = measureOfEvent.get(eventId);
        MeasureMetrics m = measureId == null ? null : metrics.get(measureId);
        if (m != null)
            m.increment(metric);
    }

    private int beatDenominatorOf(NodeStore store, Node measure) {
        Node timeSignature = store.resolveFirst(measure, Vocabulary.HAS_TIME_SIGNATURE);
        Integer denominator = timeSignature == null ? null : timeSignature.getInteger(Vocabulary.DENOMINATOR);
        return denominator != null ? denominator : defaultBeatDenominator;
    }

    /**
     * @return base denominator of the note's duration type, 0 if it has none or an unknown one
     */
    private static int baseDenominatorOf(NodeStore store, Node note) {
        Node duration = store.resolveFirst(note, Vocabulary.HAS_DURATION);
        if (duration == null || !(duration.get(Vocabulary.NOTE_TYPE) instanceof String))
            return 0;
        NoteType type = NoteType.fromText((String) duration.get(Vocabulary.NOTE_TYPE));
        return type == null ? 0 : type.getBaseDenominator();
    }


    //==========ARITHMETIC====================================================

    /**
     * @return how many notes of the base denominator fit into one beat, rounded up. The base itself if the beat
     * denominator is not positive
     */
    static int subdivision(int baseDenominator, int beatDenominator) {
        if (beatDenominator <= 0)
            return baseDenominator;
        return (int) Math.ceil(baseDenominator / (double) beatDenominator);
    }

    /**
     * @return value scaled to [0, 1] between min and max, 0 if max is not above min
     */
    static double normalize(double value, double min, double max) {
        if (max <= min)
            return 0;
        return (value - min) / (max - min);
    }

    static double mean(Collection<Double> values) {
        Validate.notEmpty(values, "mean of no values");
        double sum = 0;
        for (double v : values)
            sum += v;
        return sum / values.size();
    }

    /**
     * Round half-even on the exact binary value of the double, not on its shortest decimal form. 0.12345 is
     * stored as 0.1234500000000000041... and therefore rounds to 0.1235
     */
    static double round(double value, int decimalPlaces) {
        return new BigDecimal(value).setScale(decimalPlaces, RoundingMode.HALF_EVEN).doubleValue();
    }

    public ComplexityWeights getWeights() {
        return weights;
    }
}
