/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.graph;

import net.scoreworks.scoregraph.identity.NodeId;
import org.apache.commons.collections4.map.ListOrderedMap;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;


/**
 * Append-only collection of {@link Node}s indexed by id. This store is the only thing independently run passes
 * share: a pass never hands nodes to the next one, it computes the id again and calls
 * {@link #getOrCreate(NodeId, NodeType...)}. Iteration follows insertion order.
 * <p>
 * The store also keeps track of which nodes were created and which existing nodes were merged into since the
 * last {@link #clearActivity()}, so a pass can report what it touched.
 */
public class NodeStore {

    private final ListOrderedMap<NodeId, Node> nodes = new ListOrderedMap<>();

    private final Set<Node> created = new LinkedHashSet<>();

    private final Set<Node> merged = new LinkedHashSet<>();

    public Node getOrCreate(NodeId id, NodeType... baseTypes) {
        return getOrCreate(id, Arrays.asList(baseTypes));
    }

    /**
     * Return the node with the given id, creating it with the base types if absent. For an existing node the
     * base types are added to its types and its properties stay untouched
     */
    public Node getOrCreate(NodeId id, Collection<NodeType> baseTypes) {
        Node node = nodes.get(id);
        if (node == null) {
            node = new Node(id, baseTypes);
            nodes.put(id, node);
            created.add(node);
        }
        else {
            node.addTypes(baseTypes);
            if (!created.contains(node))
                merged.add(node);
        }
        return node;
    }

    public @Nullable Node get(NodeId id) {
        return nodes.get(id);
    }

    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @return all nodes in insertion order
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    /**
     * @return all nodes carrying the type, in insertion order
     */
    public List<Node> nodesOfType(NodeType type) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (node.hasType(type))
                result.add(node);
        }
        return result;
    }

    /**
     * Resolve the references stored under a key of the node. References to ids that are not in the store are
     * left out
     */
    public List<Node> resolve(Node node, String key) {
        List<Node> result = new ArrayList<>();
        for (NodeId target : node.getLinks(key)) {
            Node resolved = nodes.get(target);
            if (resolved != null)
                result.add(resolved);
        }
        return result;
    }

    public @Nullable Node resolveFirst(Node node, String key) {
        NodeId target = node.getLink(key);
        return target == null ? null : nodes.get(target);
    }


    //==========ACTIVITY====================================================

    public int createdCount() {
        return created.size();
    }

    public int mergedCount() {
        return merged.size();
    }

    public boolean createdContains(Node node) {
        return created.contains(node);
    }

    public void clearActivity() {
        created.clear();
        merged.clear();
    }
}
