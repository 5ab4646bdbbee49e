package net.scoreworks.scoregraph.structure;

import net.scoreworks.scoregraph.Fixtures;
import net.scoreworks.scoregraph.PassReport;
import net.scoreworks.scoregraph.ScoreContext;
import net.scoreworks.scoregraph.graph.Node;
import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.graph.NodeType;
import net.scoreworks.scoregraph.graph.Vocabulary;
import net.scoreworks.scoregraph.identity.NodeId;
import net.scoreworks.scoregraph.score.Attributes;
import net.scoreworks.scoregraph.score.Measure;
import net.scoreworks.scoregraph.score.Note;
import net.scoreworks.scoregraph.score.Part;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class StructureBuilderTest {
    ScoreContext context;
    NodeStore store;
    StructureBuilder builder = new StructureBuilder();

    @BeforeEach
    public void buildStructure() {
        context = Fixtures.sonataContext();
        store = new NodeStore();
        builder.run(context, store);
    }

    @Test
    public void testWorkAndMovements() {
        Node work = store.get(NodeId.of("so:sonata"));
        Assertions.assertTrue(work.hasType(NodeType.MUSICAL_WORK));
        Assertions.assertTrue(work.hasType(NodeType.SONATA));
        Assertions.assertEquals(List.of(NodeId.of("so:sonata_M1"), NodeId.of("so:sonata_M2")),
                work.getLinks(Vocabulary.HAS_MOVEMENT));
        Node second = store.get(NodeId.of("so:sonata_M2"));
        Assertions.assertEquals(2, second.get(Vocabulary.MOVEMENT_INDEX));
        Assertions.assertTrue(second.hasType(NodeType.SONATA_MOVEMENT));
    }

    @Test
    public void testStavesOfTwoStaffSystem() {
        Node upper = store.get(NodeId.of("so:sonata_M1_Staff_1"));
        Node lower = store.get(NodeId.of("so:sonata_M1_Staff_2"));
        Assertions.assertTrue(upper.hasType(NodeType.UPPER_PIANO_STAFF));
        Assertions.assertTrue(lower.hasType(NodeType.LOWER_PIANO_STAFF));
        Assertions.assertFalse(lower.hasType(NodeType.UPPER_PIANO_STAFF));
        Assertions.assertEquals(2, lower.get(Vocabulary.STAFF_INDEX));
        Node movement = store.get(NodeId.of("so:sonata_M1"));
        Assertions.assertEquals(List.of(upper.getId(), lower.getId()), movement.getLinks(Vocabulary.MOVEMENT_HAS_STAFF));
        Assertions.assertEquals(List.of(upper.getId(), lower.getId()), movement.getLinks(Vocabulary.SONATA_MOVEMENT_HAS_PIANO_STAFF));
    }

    @Test
    public void testMeasuresLinkedBothWays() {
        Node measure = store.get(NodeId.of("so:sonata_M2_Measure_1"));
        Assertions.assertEquals(1, measure.get(Vocabulary.NUMBER));
        Assertions.assertEquals(3, measure.get(Vocabulary.POSITION));
        Assertions.assertEquals(List.of(NodeId.of("so:sonata_M2_Staff_1"), NodeId.of("so:sonata_M2_Staff_2")),
                measure.getLinks(Vocabulary.IS_MEASURE_OF_STAFF));
        Node staff = store.get(NodeId.of("so:sonata_M2_Staff_2"));
        Assertions.assertEquals(List.of(NodeId.of("so:sonata_M2_Measure_1"), NodeId.of("so:sonata_M2_Measure_2")),
                staff.getLinks(Vocabulary.STAFF_HAS_MEASURE));
        Assertions.assertEquals(2, store.get(NodeId.of("so:sonata_M1")).getLinks(Vocabulary.MOVEMENT_HAS_MEASURE).size());
    }

    @Test
    public void testRerunIsIdempotent() {
        int size = store.size();
        Node staff = store.get(NodeId.of("so:sonata_M1_Staff_1"));
        store.clearActivity();
        PassReport report = builder.run(context, store);
        Assertions.assertEquals(size, store.size());
        Assertions.assertEquals(0, report.getCreated());
        Assertions.assertEquals(2, staff.getLinks(Vocabulary.STAFF_HAS_MEASURE).size());
        Assertions.assertEquals(2, store.get(NodeId.of("so:sonata")).getLinks(Vocabulary.HAS_MOVEMENT).size());
    }

    @Test
    public void testSingleStaffHasNoPianoRole() {
        ScoreContext single = Fixtures.context("solo.xml", Fixtures.measure("1",
                new Attributes(1, null, List.of(), null), Note.builder().pitch("C", "4").type("whole").build()));
        NodeStore singleStore = new NodeStore();
        builder.run(single, singleStore);
        Node staff = singleStore.get(NodeId.of("so:solo_M1_Staff_1"));
        Assertions.assertFalse(staff.hasType(NodeType.UPPER_PIANO_STAFF));
        Assertions.assertNull(singleStore.get(NodeId.of("so:solo_M1_Staff_2")));
    }

    @Test
    public void testStaffCountDetection() {
        Measure noStaves = new Measure("1", List.of(Note.builder().staff(3).build()));
        Assertions.assertEquals(3, StructureBuilder.detectStaffCount(new Part("P1", List.of(noStaves)), 2));
        Measure bare = new Measure("1", List.of(Note.builder().build()));
        Assertions.assertEquals(2, StructureBuilder.detectStaffCount(new Part("P1", List.of(bare)), 2));
        Measure declared = new Measure("1", List.of(new Attributes(0, null, List.of(), null),
                new Attributes(4, null, List.of(), null)));
        Assertions.assertEquals(4, StructureBuilder.detectStaffCount(new Part("P1", List.of(declared, noStaves)), 2));
    }

    @Test
    public void testMeasureWithoutLabelUsesPosition() {
        ScoreContext unlabeled = Fixtures.context("bare.xml", Fixtures.measure(null), Fixtures.measure("x.1"));
        NodeStore bareStore = new NodeStore();
        builder.run(unlabeled, bareStore);
        Assertions.assertEquals(1, bareStore.get(NodeId.of("so:bare_M1_Measure_1")).get(Vocabulary.NUMBER));
        Assertions.assertEquals("x.1", bareStore.get(NodeId.of("so:bare_M1_Measure_x_1")).get(Vocabulary.NUMBER));
    }
}
