/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.structure;

import net.scoreworks.scoregraph.ExtractionPass;
import net.scoreworks.scoregraph.PassReport;
import net.scoreworks.scoregraph.ScoreContext;
import net.scoreworks.scoregraph.graph.Node;
import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.graph.NodeType;
import net.scoreworks.scoregraph.graph.Vocabulary;
import net.scoreworks.scoregraph.identity.PositionalIds;
import net.scoreworks.scoregraph.score.Attributes;
import net.scoreworks.scoregraph.score.Measure;
import net.scoreworks.scoregraph.score.Note;
import net.scoreworks.scoregraph.score.Part;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;


/**
 * Builds the skeleton of the graph: the work, one node per movement, the staves of every movement and the
 * measures, all linked in both directions where the vocabulary has both directions.
 */
public class StructureBuilder implements ExtractionPass {
    private static final Logger LOG = LoggerFactory.getLogger(StructureBuilder.class);

    @Override
    public String getName() {
        return "structure";
    }

    @Override
    public PassReport run(ScoreContext context, NodeStore store) {
        List<PositionedMeasure> measures = context.getPositionedMeasures();
        int staffCount = detectStaffCount(context.getPart(), context.getConfig().getDefaultStaffCount());
        PositionalIds ids = context.getIds();
        LOG.debug("{} movement(s), {} staves", context.getSegments().size(), staffCount);

        Node work = store.getOrCreate(ids.work(), NodeType.MUSICAL_WORK, NodeType.SONATA);

        for (MovementSegment segment : context.getSegments()) {
            int m = segment.getMovementIndex();
            Node movement = store.getOrCreate(ids.movement(m),
                    NodeType.MOVEMENT, NodeType.SONATA_MOVEMENT, NodeType.STRUCTURAL_ELEMENT);
            movement.set(Vocabulary.MOVEMENT_INDEX, m);

            //staves
            List<Node> staves = new ArrayList<>();
            for (int s = 1; s <= staffCount; s++) {
                Node staff = store.getOrCreate(ids.staff(m, s), staffTypes(s, staffCount));
                staff.set(Vocabulary.STAFF_INDEX, s);
                movement.appendLink(Vocabulary.MOVEMENT_HAS_STAFF, staff.getId());
                movement.appendLink(Vocabulary.SONATA_MOVEMENT_HAS_PIANO_STAFF, staff.getId());
                staves.add(staff);
            }

            //measures
            for (PositionedMeasure positioned : measures) {
                if (positioned.getMovementIndex() != m)
                    continue;
                Node measure = store.getOrCreate(positioned.getMeasureId(), NodeType.MEASURE, NodeType.STRUCTURAL_ELEMENT);
                measure.set(Vocabulary.NUMBER, positioned.getNumberValue());
                measure.set(Vocabulary.POSITION, positioned.getPosition());
                for (Node staff : staves) {
                    measure.appendLink(Vocabulary.IS_MEASURE_OF_STAFF, staff.getId());
                    staff.appendLink(Vocabulary.STAFF_HAS_MEASURE, measure.getId());
                }
                movement.appendLink(Vocabulary.MOVEMENT_HAS_MEASURE, measure.getId());
            }
            work.appendLink(Vocabulary.HAS_MOVEMENT, movement.getId());
        }
        return PassReport.of(getName(), store, 0);
    }

    private static List<NodeType> staffTypes(int staffIndex, int staffCount) {
        List<NodeType> types = new ArrayList<>(List.of(NodeType.STAFF, NodeType.PIANO_STAFF, NodeType.STRUCTURAL_ELEMENT));
        //upper and lower roles only exist for the usual two-staff piano system
        if (staffCount == 2)
            types.add(staffIndex == 1 ? NodeType.UPPER_PIANO_STAFF : NodeType.LOWER_PIANO_STAFF);
        return types;
    }

    /**
     * The first positive staff count declared in any attributes block wins. Otherwise the highest staff number
     * a note refers to, otherwise the fallback
     */
    static int detectStaffCount(Part part, int fallback) {
        for (Measure measure : part.getMeasures()) {
            for (Attributes attributes : measure.getAttributeBlocks()) {
                Integer staves = attributes.getStaves();
                if (staves != null && staves > 0)
                    return staves;
            }
        }
        int maxStaff = 0;
        for (Measure measure : part.getMeasures()) {
            for (Note note : measure.getNotes()) {
                if (note.getStaff() != null)
                    maxStaff = Math.max(maxStaff, note.getStaff());
            }
        }
        return maxStaff > 0 ? maxStaff : fallback;
    }
}
