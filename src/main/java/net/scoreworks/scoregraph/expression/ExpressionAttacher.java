/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.expression;

import net.scoreworks.scoregraph.ExtractionPass;
import net.scoreworks.scoregraph.PassReport;
import net.scoreworks.scoregraph.ScoreContext;
import net.scoreworks.scoregraph.graph.Node;
import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.graph.NodeType;
import net.scoreworks.scoregraph.graph.Vocabulary;
import net.scoreworks.scoregraph.identity.EventCounter;
import net.scoreworks.scoregraph.identity.NodeId;
import net.scoreworks.scoregraph.identity.PositionalIds;
import net.scoreworks.scoregraph.identity.SubFeature;
import net.scoreworks.scoregraph.score.Direction;
import net.scoreworks.scoregraph.score.MeasureElement;
import net.scoreworks.scoregraph.score.Note;
import net.scoreworks.scoregraph.structure.PositionedMeasure;
import org.apache.commons.collections4.multimap.ArrayListValuedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;


/**
 * Attaches dynamics and articulations to the symbolic events of the notation pass. Events are found again by
 * recomputing their ids with a fresh {@link EventCounter} in the same traversal order, so this pass can also
 * run alone and create bare events.
 * <p>
 * A dynamic written as direction waits in a queue of its staff and binds to the next note or rest on that staff
 * within the same measure. Queues are dropped at the end of each measure.
 */
public class ExpressionAttacher implements ExtractionPass {
    private static final Logger LOG = LoggerFactory.getLogger(ExpressionAttacher.class);

    @Override
    public String getName() {
        return "expression";
    }

    @Override
    public PassReport run(ScoreContext context, NodeStore store) {
        Traversal traversal = new Traversal(context.getIds(), store);
        for (PositionedMeasure measure : context.getPositionedMeasures())
            traversal.visit(measure);
        if (traversal.createdEvents > 0 && traversal.storeHadEvents) {
            LOG.warn("{} event(s) were not found in a graph that holds symbolic events, their ids disagree with the notation pass",
                    traversal.createdEvents);
        }
        return PassReport.of(getName(), store, traversal.skipped);
    }


    private static class Traversal {
        final PositionalIds ids;
        final NodeStore store;
        final EventCounter counter = new EventCounter();
        final boolean storeHadEvents;

        /** staff index to the dynamic markings waiting for the next event on that staff */
        final ArrayListValuedHashMap<Integer, DynamicMarking> pending = new ArrayListValuedHashMap<>();

        /** how many dynamics and articulations each event got so far in this run */
        final Map<NodeId, Integer> dynamicCounts = new HashMap<>();
        final Map<NodeId, Integer> articulationCounts = new HashMap<>();

        int createdEvents;
        int skipped;

        Traversal(PositionalIds ids, NodeStore store) {
            this.ids = ids;
            this.store = store;
            this.storeHadEvents = !store.nodesOfType(NodeType.SYMBOLIC_EVENT).isEmpty();
        }

        void visit(PositionedMeasure positioned) {
            pending.clear();
            for (MeasureElement element : positioned.getMeasure().getElements()) {
                if (element instanceof Direction)
                    queueDynamics((Direction) element);
                else if (element instanceof Note)
                    attach((Note) element, positioned.getMeasureId());
            }
        }

        private void queueDynamics(Direction direction) {
            int staffIndex = direction.getStaff() != null ? direction.getStaff() : 1;
            for (String token : direction.getDynamics()) {
                DynamicMarking marking = DynamicMarking.fromToken(token);
                if (marking != null)
                    pending.put(staffIndex, marking);
                else
                    skipped++;
            }
        }

        private void attach(Note note, NodeId measureId) {
            int staffIndex = note.getStaff() != null ? note.getStaff() : 1;
            NodeId eventId = ids.event(measureId, counter.next());
            boolean known = store.contains(eventId);
            Node event = store.getOrCreate(eventId, NodeType.SYMBOLIC_EVENT, NodeType.MUSIC_NOTATION_ELEMENT);
            if (!known)
                createdEvents++;

            for (DynamicMarking marking : pending.remove(staffIndex))
                addDynamic(event, marking);
            for (String token : note.getDynamics()) {
                DynamicMarking marking = DynamicMarking.fromToken(token);
                if (marking != null)
                    addDynamic(event, marking);
                else
                    skipped++;
            }

            for (String tag : note.getArticulations()) {
                ArticulationKind kind = ArticulationKind.fromArticulationTag(tag);
                if (kind != null)
                    addArticulation(event, kind);
                else
                    LOG.debug("Ignoring articulation {} at {}", tag, eventId);
            }
            for (String slurType : note.getSlurTypes()) {
                ArticulationKind kind = ArticulationKind.fromSlurType(slurType);
                if (kind != null)
                    addArticulation(event, kind);
            }
        }

        private void addDynamic(Node event, DynamicMarking marking) {
            int n = dynamicCounts.merge(event.getId(), 1, Integer::sum);
            NodeId dynamicId = SubFeature.DYNAMIC.of(event.getId(), n);
            Node dynamic = store.getOrCreate(dynamicId, NodeType.DYNAMIC, NodeType.EXPRESSIVE_ELEMENT, NodeType.LOUDNESS_DYNAMIC);
            dynamic.set(Vocabulary.DYNAMIC_VALUE, marking.getToken());
            dynamic.set(Vocabulary.DYNAMIC_LEVEL, marking.getLevel());
            dynamic.link(Vocabulary.IS_DYNAMIC_OF, event.getId());
            event.appendLink(Vocabulary.HAS_DYNAMIC, dynamicId);
        }

        private void addArticulation(Node event, ArticulationKind kind) {
            int n = articulationCounts.merge(event.getId(), 1, Integer::sum);
            NodeId articulationId = SubFeature.ARTICULATION.of(event.getId(), n);
            Node articulation = store.getOrCreate(articulationId, NodeType.ARTICULATION, NodeType.EXPRESSIVE_ELEMENT, kind.getType());
            articulation.set(Vocabulary.ARTICULATION_TEXT, kind.getText());
            articulation.link(Vocabulary.IS_ARTICULATION_OF, event.getId());
            event.appendLink(Vocabulary.HAS_ARTICULATION, articulationId);
        }
    }
}
