/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.document;

import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.graph.Vocabulary;
import org.apache.commons.collections4.map.ListOrderedMap;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;


/**
 * A graph document: the namespace context and the nodes of one work. The default namespaces of
 * {@link Vocabulary} are always part of the context, prefixes an input document declared in addition are kept.
 */
public class GraphDocument {

    /** prefix to namespace IRI, in declaration order */
    private final ListOrderedMap<String, String> context = new ListOrderedMap<>();

    private final NodeStore store;

    public GraphDocument() {
        this(new NodeStore());
    }

    public GraphDocument(NodeStore store) {
        Validate.notNull(store);
        this.store = store;
        addDefaultPrefixes();
    }

    /**
     * @return a document with the given context. Missing default prefixes are appended, declared ones are kept
     * even if they differ from the defaults
     */
    public static GraphDocument of(Map<String, String> declaredContext, NodeStore store) {
        GraphDocument document = new GraphDocument(store);
        document.context.clear();
        document.context.putAll(declaredContext);
        document.addDefaultPrefixes();
        return document;
    }

    private void addDefaultPrefixes() {
        for (Map.Entry<String, String> entry : Vocabulary.defaultContext().entrySet())
            context.putIfAbsent(entry.getKey(), entry.getValue());
    }

    public NodeStore getStore() {
        return store;
    }

    public Map<String, String> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public void putPrefix(String prefix, String namespace) {
        Validate.notBlank(prefix, "prefix must not be blank");
        Validate.notBlank(namespace, "namespace must not be blank");
        context.put(prefix, namespace);
    }

    /**
     * @return the full IRI of a compact IRI whose prefix is declared, else null
     */
    public @Nullable String expand(String compactIri) {
        String prefix = StringUtils.substringBefore(compactIri, ":");
        if (prefix.equals(compactIri))
            return null;
        String namespace = context.get(prefix);
        return namespace == null ? null : namespace + compactIri.substring(prefix.length() + 1);
    }
}
