/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.graph;

import net.scoreworks.scoregraph.identity.NodeId;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * A node of the score graph. Its identity is its {@link NodeId}. Types only accumulate over the lifetime of a
 * node, properties are plain key assignments where the last write wins.
 * <p>
 * Property values are strings, numbers, booleans, {@link NodeId} references, lists of those, or opaque values
 * that were read from an input document and are written back untouched.
 */
public class Node {
    private final NodeId id;
    private final Set<NodeType> types = new LinkedHashSet<>();
    private final Map<String, Object> properties = new LinkedHashMap<>();

    Node(NodeId id, Collection<NodeType> types) {
        this.id = id;
        this.types.addAll(types);
    }

    public NodeId getId() {
        return id;
    }

    public Set<NodeType> getTypes() {
        return Collections.unmodifiableSet(types);
    }

    public boolean hasType(NodeType type) {
        return types.contains(type);
    }

    /**
     * Add a type. Types are never removed
     * @return true if the type was not present before
     */
    public boolean addType(NodeType type) {
        Validate.notNull(type);
        return types.add(type);
    }

    boolean addTypes(Collection<NodeType> newTypes) {
        return types.addAll(newTypes);
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public boolean has(String key) {
        return properties.containsKey(key);
    }

    public Object get(String key) {
        return properties.get(key);
    }

    /**
     * Assign a property. A null value is stored as such, it does not remove the key
     */
    public Node set(String key, @Nullable Object value) {
        properties.put(key, value);
        return this;
    }

    /**
     * @return the removed value or null
     */
    public Object remove(String key) {
        return properties.remove(key);
    }

    public @Nullable String getString(String key) {
        Object value = properties.get(key);
        return value == null ? null : value.toString();
    }

    /**
     * @return the property as integer, or null if it is absent, not a whole number or out of int range
     */
    public @Nullable Integer getInteger(String key) {
        Object value = properties.get(key);
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE)
                return null;
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public @Nullable Double getDouble(String key) {
        Object value = properties.get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }


    //==========REFERENCES====================================================

    /**
     * Point a single-valued relation at the target, replacing an earlier target
     */
    public Node link(String key, NodeId target) {
        properties.put(key, target);
        return this;
    }

    /**
     * Add the target to a multi-valued relation unless it is already contained. A single reference stored
     * under the key is turned into a list first
     */
    public Node appendLink(String key, NodeId target) {
        Object value = properties.get(key);
        List<Object> current;
        if (value instanceof List) {
            current = new ArrayList<>((List<?>) value);
        }
        else {
            current = new ArrayList<>();
            if (value instanceof NodeId)
                current.add(value);
        }
        if (!current.contains(target))
            current.add(target);
        properties.put(key, current);
        return this;
    }

    /**
     * @return all node references stored under the key, whether stored as single reference or as list
     */
    public List<NodeId> getLinks(String key) {
        Object value = properties.get(key);
        if (value instanceof NodeId)
            return List.of((NodeId) value);
        if (value instanceof List) {
            List<NodeId> links = new ArrayList<>();
            for (Object o : (List<?>) value) {
                if (o instanceof NodeId)
                    links.add((NodeId) o);
            }
            return links;
        }
        return List.of();
    }

    /**
     * @return the first node reference stored under the key, or null
     */
    public @Nullable NodeId getLink(String key) {
        List<NodeId> links = getLinks(key);
        return links.isEmpty() ? null : links.get(0);
    }

    @Override
    public String toString() {
        return id + " " + types;
    }
}
