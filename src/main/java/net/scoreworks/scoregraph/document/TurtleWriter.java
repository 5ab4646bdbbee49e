/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.document;

import net.scoreworks.scoregraph.graph.Node;
import net.scoreworks.scoregraph.graph.NodeType;
import net.scoreworks.scoregraph.identity.NodeId;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;


/**
 * Renders a {@link GraphDocument} as Turtle: one prefix declaration per context entry, then one subject block per
 * node in graph order. Compact IRIs are kept compact when their prefix is declared and their local name is a
 * valid Turtle local name, otherwise they are written as full IRIs. Null values are left out, opaque values are
 * written as their JSON text.
 */
public final class TurtleWriter {
    private static final Logger LOG = LoggerFactory.getLogger(TurtleWriter.class);

    private static final String INDENT = "    ";

    private static final Pattern LOCAL_NAME = Pattern.compile("[A-Za-z0-9_]([A-Za-z0-9_.\\-]*[A-Za-z0-9_\\-])?");

    private final GraphDocument document;
    private final StringBuilder strb = new StringBuilder();

    private TurtleWriter(GraphDocument document) {
        this.document = document;
    }

    public static String toTurtle(GraphDocument document) {
        TurtleWriter writer = new TurtleWriter(document);
        writer.printPrefixes();
        for (Node node : document.getStore().nodes())
            writer.printSubject(node);
        return writer.strb.toString();
    }

    public static void write(GraphDocument document, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        Files.writeString(path, toTurtle(document), StandardCharsets.UTF_8);
        LOG.debug("Wrote {} subject(s) to {}", document.getStore().size(), path);
    }

    private void printPrefixes() {
        for (Map.Entry<String, String> entry : document.getContext().entrySet())
            strb.append("@prefix ").append(entry.getKey()).append(": <").append(entry.getValue()).append("> .\n");
        strb.append("\n");
    }

    private void printSubject(Node node) {
        List<String> predicates = new ArrayList<>();
        if (!node.getTypes().isEmpty()) {
            List<String> types = new ArrayList<>();
            for (NodeType type : node.getTypes())
                types.add(iri(type.toString()));
            predicates.add("a " + String.join(", ", types));
        }
        for (Map.Entry<String, Object> property : node.getProperties().entrySet()) {
            List<String> objects = new ArrayList<>();
            collectObjects(property.getValue(), objects);
            if (!objects.isEmpty())
                predicates.add(iri(property.getKey()) + " " + String.join(", ", objects));
        }
        //a subject needs at least one predicate
        if (predicates.isEmpty())
            return;
        strb.append(iri(node.getId().value()));
        for (int i = 0; i < predicates.size(); i++) {
            strb.append(i == 0 ? " " : " ;\n" + INDENT);
            strb.append(predicates.get(i));
        }
        strb.append(" .\n\n");
    }

    private void collectObjects(Object value, List<String> objects) {
        if (value == null)
            return;
        if (value instanceof List) {
            for (Object element : (List<?>) value)
                collectObjects(element, objects);
        }
        else if (value instanceof NodeId)
            objects.add(iri(((NodeId) value).value()));
        else if (value instanceof Integer || value instanceof Long || value instanceof Boolean)
            objects.add(value.toString());
        else if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            objects.add(Double.isFinite(d) ? Double.toString(d) : literal(Double.toString(d)));
        }
        //strings, and opaque JSON values as their text
        else
            objects.add(literal(value.toString()));
    }

    /**
     * @return the term as prefixed name if possible, else as full IRI in angle brackets
     */
    String iri(String term) {
        String prefix = StringUtils.substringBefore(term, ":");
        if (!prefix.equals(term) && document.getContext().containsKey(prefix)) {
            String localName = term.substring(prefix.length() + 1);
            if (LOCAL_NAME.matcher(localName).matches())
                return term;
            return "<" + document.expand(term) + ">";
        }
        return "<" + term + ">";
    }

    static String literal(String text) {
        StringBuilder escaped = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\': escaped.append("\\\\"); break;
                case '"': escaped.append("\\\""); break;
                case '\n': escaped.append("\\n"); break;
                case '\r': escaped.append("\\r"); break;
                case '\t': escaped.append("\\t"); break;
                default: escaped.append(c);
            }
        }
        return escaped.append("\"").toString();
    }
}
