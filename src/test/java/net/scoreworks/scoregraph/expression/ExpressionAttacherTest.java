package net.scoreworks.scoregraph.expression;

import net.scoreworks.scoregraph.Fixtures;
import net.scoreworks.scoregraph.PassReport;
import net.scoreworks.scoregraph.ScoreContext;
import net.scoreworks.scoregraph.graph.Node;
import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.graph.NodeType;
import net.scoreworks.scoregraph.graph.Vocabulary;
import net.scoreworks.scoregraph.identity.NodeId;
import net.scoreworks.scoregraph.notation.NotationBuilder;
import net.scoreworks.scoregraph.score.Direction;
import net.scoreworks.scoregraph.score.Note;
import net.scoreworks.scoregraph.structure.StructureBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ExpressionAttacherTest {
    ScoreContext context;
    NodeStore store;

    @BeforeEach
    public void buildGraph() {
        context = Fixtures.sonataContext();
        store = new NodeStore();
        new StructureBuilder().run(context, store);
        new NotationBuilder().run(context, store);
        new ExpressionAttacher().run(context, store);
    }

    private Node node(NodeStore nodes, String id) {
        return nodes.get(NodeId.of(id));
    }

    private static Direction dynamics(Integer staff, String... tokens) {
        return new Direction(staff, null, List.of(tokens), null, null);
    }

    @Test
    public void testDirectionDynamicBindsToNextEventOnStaff() {
        Node event = node(store, "so:sonata_M1_Measure_1_Event_000001");
        NodeId dynamicId = NodeId.of("so:sonata_M1_Measure_1_Event_000001_Dyn_1");
        Assertions.assertEquals(List.of(dynamicId), event.getLinks(Vocabulary.HAS_DYNAMIC));
        Node dynamic = store.get(dynamicId);
        Assertions.assertTrue(dynamic.hasType(NodeType.LOUDNESS_DYNAMIC));
        Assertions.assertEquals("p", dynamic.get(Vocabulary.DYNAMIC_VALUE));
        Assertions.assertEquals(3, dynamic.get(Vocabulary.DYNAMIC_LEVEL));
        Assertions.assertEquals(event.getId(), dynamic.getLink(Vocabulary.IS_DYNAMIC_OF));
        Assertions.assertTrue(node(store, "so:sonata_M1_Measure_1_Event_000002").getLinks(Vocabulary.HAS_DYNAMIC).isEmpty());
    }

    @Test
    public void testStaffQueuesAreIsolated() {
        //ff is written for the lower staff, the two upper staff notes before it stay untouched
        Assertions.assertFalse(node(store, "so:sonata_M2_Measure_1_Event_000007").has(Vocabulary.HAS_DYNAMIC));
        Assertions.assertFalse(node(store, "so:sonata_M2_Measure_1_Event_000008").has(Vocabulary.HAS_DYNAMIC));
        Node dynamic = node(store, "so:sonata_M2_Measure_1_Event_000009_Dyn_1");
        Assertions.assertEquals("ff", dynamic.get(Vocabulary.DYNAMIC_VALUE));
        Assertions.assertEquals(7, dynamic.get(Vocabulary.DYNAMIC_LEVEL));
    }

    @Test
    public void testNoteDynamicsAndArticulations() {
        Assertions.assertEquals("f", node(store, "so:sonata_M2_Measure_2_Event_000010_Dyn_1").get(Vocabulary.DYNAMIC_VALUE));

        Node staccato = node(store, "so:sonata_M1_Measure_1_Event_000001_Art_1");
        Assertions.assertTrue(staccato.hasType(ArticulationKind.STACCATO.getType()));
        Assertions.assertTrue(staccato.hasType(NodeType.ARTICULATION));
        Assertions.assertEquals("staccato", staccato.get(Vocabulary.ARTICULATION_TEXT));
        Assertions.assertEquals(NodeId.of("so:sonata_M1_Measure_1_Event_000001"), staccato.getLink(Vocabulary.IS_ARTICULATION_OF));

        Node legato = node(store, "so:sonata_M1_Measure_1_Event_000003_Art_1");
        Assertions.assertTrue(legato.hasType(ArticulationKind.LEGATO.getType()));
        Assertions.assertEquals(List.of(legato.getId()),
                node(store, "so:sonata_M1_Measure_1_Event_000003").getLinks(Vocabulary.HAS_ARTICULATION));
    }

    @Test
    public void testRerunRewritesSameNodes() {
        int size = store.size();
        store.clearActivity();
        PassReport report = new ExpressionAttacher().run(context, store);
        Assertions.assertEquals(size, store.size());
        Assertions.assertEquals(0, report.getCreated());
        Assertions.assertEquals(1, node(store, "so:sonata_M1_Measure_1_Event_000001").getLinks(Vocabulary.HAS_DYNAMIC).size());
    }

    @Test
    public void testPendingQueueOfOtherStaffAndMeasureBoundaries() {
        ScoreContext queued = Fixtures.context("queued.xml",
                Fixtures.measure("1",
                        dynamics(2, "pp"),
                        Note.builder().pitch("C", "5").staff(1).build(),
                        Note.builder().pitch("C", "3").staff(2).build(),
                        dynamics(null, "mf", "sfz", "sf"),
                        Note.builder().rest().dynamic("fp").build(),
                        dynamics(1, "ppp")),
                Fixtures.measure("2",
                        Note.builder().pitch("D", "5").staff(1).build()));
        NodeStore queuedStore = new NodeStore();
        PassReport report = new ExpressionAttacher().run(queued, queuedStore);

        Assertions.assertFalse(node(queuedStore, "so:queued_M1_Measure_1_Event_000001").has(Vocabulary.HAS_DYNAMIC));
        Assertions.assertEquals("pp", node(queuedStore, "so:queued_M1_Measure_1_Event_000002_Dyn_1").get(Vocabulary.DYNAMIC_VALUE));

        //queued markings first, then the marks of the note itself
        Node rest = node(queuedStore, "so:queued_M1_Measure_1_Event_000003");
        Assertions.assertEquals(3, rest.getLinks(Vocabulary.HAS_DYNAMIC).size());
        Assertions.assertEquals("mf", node(queuedStore, "so:queued_M1_Measure_1_Event_000003_Dyn_1").get(Vocabulary.DYNAMIC_VALUE));
        Assertions.assertEquals("sf", node(queuedStore, "so:queued_M1_Measure_1_Event_000003_Dyn_2").get(Vocabulary.DYNAMIC_VALUE));
        Assertions.assertEquals("fp", node(queuedStore, "so:queued_M1_Measure_1_Event_000003_Dyn_3").get(Vocabulary.DYNAMIC_VALUE));
        Assertions.assertEquals(1, report.getSkipped());

        //ppp at the end of measure 1 is dropped with the queue
        Assertions.assertFalse(node(queuedStore, "so:queued_M1_Measure_2_Event_000004").has(Vocabulary.HAS_DYNAMIC));
    }

    @Test
    public void testRunningAloneCreatesBareEvents() {
        NodeStore alone = new NodeStore();
        new ExpressionAttacher().run(context, alone);
        Node event = node(alone, "so:sonata_M1_Measure_1_Event_000001");
        Assertions.assertTrue(event.hasType(NodeType.SYMBOLIC_EVENT));
        Assertions.assertFalse(event.hasType(NodeType.NOTE));
        Assertions.assertEquals(10, alone.nodesOfType(NodeType.SYMBOLIC_EVENT).size());
    }

    @Test
    public void testMarkingTables() {
        Assertions.assertEquals(DynamicMarking.SFP, DynamicMarking.fromToken("sfp"));
        Assertions.assertEquals(6, DynamicMarking.fromToken("pf").getLevel());
        Assertions.assertNull(DynamicMarking.fromToken("sfz"));
        Assertions.assertEquals(ArticulationKind.TENUTO, ArticulationKind.fromArticulationTag("tenuto"));
        Assertions.assertNull(ArticulationKind.fromArticulationTag("legato"));
        Assertions.assertNull(ArticulationKind.fromArticulationTag("strong-accent"));
        Assertions.assertEquals(ArticulationKind.LEGATO, ArticulationKind.fromSlurType("start"));
        Assertions.assertNull(ArticulationKind.fromSlurType("stop"));
    }
}
