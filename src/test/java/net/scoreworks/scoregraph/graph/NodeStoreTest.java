package net.scoreworks.scoregraph.graph;

import net.scoreworks.scoregraph.identity.NodeId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class NodeStoreTest {
    NodeStore store;
    NodeId measureId = NodeId.of("so:w_M1_Measure_1");
    NodeId eventId = NodeId.of("so:w_M1_Measure_1_Event_000001");

    @BeforeEach
    public void prepareStore() {
        store = new NodeStore();
    }

    @Test
    public void testGetOrCreateReturnsSameNode() {
        Node created = store.getOrCreate(measureId, NodeType.MEASURE);
        Node merged = store.getOrCreate(measureId, NodeType.STRUCTURAL_ELEMENT);
        Assertions.assertSame(created, merged);
        Assertions.assertEquals(1, store.size());
        Assertions.assertTrue(merged.hasType(NodeType.MEASURE));
        Assertions.assertTrue(merged.hasType(NodeType.STRUCTURAL_ELEMENT));
    }

    @Test
    public void testMergeKeepsProperties() {
        store.getOrCreate(measureId, NodeType.MEASURE).set(Vocabulary.NUMBER, 1);
        Node merged = store.getOrCreate(measureId, NodeType.MEASURE);
        Assertions.assertEquals(1, merged.get(Vocabulary.NUMBER));
        Assertions.assertEquals(1, merged.getTypes().size());
        merged.set(Vocabulary.NUMBER, 2);
        Assertions.assertEquals(2, store.get(measureId).getInteger(Vocabulary.NUMBER));
    }

    @Test
    public void testInsertionOrderIsKept() {
        store.getOrCreate(eventId, NodeType.SYMBOLIC_EVENT);
        store.getOrCreate(measureId, NodeType.MEASURE);
        store.getOrCreate(eventId, NodeType.NOTE);
        List<Node> nodes = store.nodes();
        Assertions.assertEquals(eventId, nodes.get(0).getId());
        Assertions.assertEquals(measureId, nodes.get(1).getId());
        Assertions.assertEquals(List.of(store.get(eventId)), store.nodesOfType(NodeType.NOTE));
    }

    @Test
    public void testActivityTracking() {
        store.getOrCreate(measureId, NodeType.MEASURE);
        store.getOrCreate(measureId, NodeType.MEASURE);
        Assertions.assertEquals(1, store.createdCount());
        Assertions.assertEquals(0, store.mergedCount());

        store.clearActivity();
        Assertions.assertEquals(0, store.createdCount());
        Assertions.assertEquals(0, store.mergedCount());
        store.getOrCreate(measureId, NodeType.MEASURE);
        store.getOrCreate(eventId, NodeType.SYMBOLIC_EVENT);
        Assertions.assertEquals(1, store.createdCount());
        Assertions.assertEquals(1, store.mergedCount());
        Assertions.assertTrue(store.createdContains(store.get(eventId)));
    }

    @Test
    public void testResolveLeavesOutMissingTargets() {
        Node measure = store.getOrCreate(measureId, NodeType.MEASURE);
        store.getOrCreate(eventId, NodeType.SYMBOLIC_EVENT);
        measure.appendLink(Vocabulary.HAS_SYMBOLIC_EVENT, eventId);
        measure.appendLink(Vocabulary.HAS_SYMBOLIC_EVENT, NodeId.of("so:missing"));
        Assertions.assertEquals(2, measure.getLinks(Vocabulary.HAS_SYMBOLIC_EVENT).size());
        Assertions.assertEquals(List.of(store.get(eventId)), store.resolve(measure, Vocabulary.HAS_SYMBOLIC_EVENT));
        Assertions.assertNull(store.resolveFirst(measure, Vocabulary.HAS_TIME_SIGNATURE));
    }
}
