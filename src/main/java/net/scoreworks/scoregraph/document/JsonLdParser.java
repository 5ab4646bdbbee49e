/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.document;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import net.scoreworks.scoregraph.exceptions.GraphDocumentException;
import net.scoreworks.scoregraph.graph.Node;
import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.graph.NodeType;
import net.scoreworks.scoregraph.identity.NodeId;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Reads and writes {@link GraphDocument}s as JSON-LD shaped text: an {@code @context} object mapping prefixes to
 * namespaces and a {@code @graph} array of nodes. Every node is an object with {@code @id}, {@code @type} and its
 * properties. Values are translated as follows:
 *
 * <ul>
 *  <li>{@code {"@id": "..."}}: a {@link NodeId} reference</li>
 *  <li>numbers: Integer or Long when written without fraction or exponent, else Double</li>
 *  <li>strings, booleans and null: as they are</li>
 *  <li>arrays: lists of the translated elements</li>
 *  <li>any other object: kept as opaque {@link JsonElement} and written back untouched</li>
 * </ul>
 * The reader also accepts {@code context} and {@code graph} without the at sign, and a single string as
 * {@code @type}. The writer always writes {@code @type} as array.
 */
public final class JsonLdParser {
    private static final Logger LOG = LoggerFactory.getLogger(JsonLdParser.class);

    private static final String ID = "@id";
    private static final String TYPE = "@type";
    private static final String CONTEXT = "@context";
    private static final String GRAPH = "@graph";

    private JsonLdParser() {}


    //==========SERIALIZATION====================================================

    public static String toJson(GraphDocument document, boolean prettyPrinting) {
        return gson(prettyPrinting).toJson(toTree(document));
    }

    public static void write(GraphDocument document, Path path, boolean prettyPrinting) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson(prettyPrinting).toJson(toTree(document), writer);
        }
        LOG.debug("Wrote {} node(s) to {}", document.getStore().size(), path);
    }

    private static Gson gson(boolean prettyPrinting) {
        GsonBuilder builder = new GsonBuilder().serializeNulls().disableHtmlEscaping();
        if (prettyPrinting)
            builder.setPrettyPrinting();
        return builder.create();
    }

    static JsonObject toTree(GraphDocument document) {
        JsonObject root = new JsonObject();
        JsonObject context = new JsonObject();
        for (Map.Entry<String, String> entry : document.getContext().entrySet())
            context.addProperty(entry.getKey(), entry.getValue());
        root.add(CONTEXT, context);

        JsonArray graph = new JsonArray();
        for (Node node : document.getStore().nodes())
            graph.add(printNode(node));
        root.add(GRAPH, graph);
        return root;
    }

    private static JsonObject printNode(Node node) {
        JsonObject object = new JsonObject();
        object.addProperty(ID, node.getId().value());
        if (!node.getTypes().isEmpty()) {
            JsonArray types = new JsonArray();
            for (NodeType type : node.getTypes())
                types.add(type.toString());
            object.add(TYPE, types);
        }
        for (Map.Entry<String, Object> property : node.getProperties().entrySet())
            object.add(property.getKey(), printValue(property.getValue(), node.getId()));
        return object;
    }

    private static JsonElement printValue(@Nullable Object value, NodeId owner) {
        if (value == null)
            return JsonNull.INSTANCE;
        if (value instanceof NodeId) {
            JsonObject reference = new JsonObject();
            reference.addProperty(ID, ((NodeId) value).value());
            return reference;
        }
        if (value instanceof String)
            return new JsonPrimitive((String) value);
        if (value instanceof Number)
            return new JsonPrimitive((Number) value);
        if (value instanceof Boolean)
            return new JsonPrimitive((Boolean) value);
        if (value instanceof JsonElement)
            return ((JsonElement) value).deepCopy();
        if (value instanceof List) {
            JsonArray array = new JsonArray();
            for (Object element : (List<?>) value)
                array.add(printValue(element, owner));
            return array;
        }
        throw new GraphDocumentException("property value of type " + value.getClass().getSimpleName()
                + " can't be written", owner.value());
    }


    //==========DESERIALIZATION====================================================

    /**
     * @throws GraphDocumentException if the text is no JSON object or a node has no usable id
     */
    public static GraphDocument fromJson(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new GraphDocumentException("document is no valid JSON", e);
        }
        return fromTree(root);
    }

    /**
     * Read the document at the path. A path that does not exist yields an empty document
     */
    public static GraphDocument read(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.debug("{} does not exist, starting with an empty graph", path);
            return new GraphDocument();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromTree(JsonParser.parseReader(reader));
        } catch (JsonParseException e) {
            throw new GraphDocumentException(path + " is no valid JSON", e);
        }
    }

    static GraphDocument fromTree(JsonElement root) {
        if (!root.isJsonObject())
            throw new GraphDocumentException("document root must be a JSON object");
        JsonObject object = root.getAsJsonObject();

        Map<String, String> context = new LinkedHashMap<>();
        JsonElement contextElement = memberOf(object, CONTEXT);
        if (contextElement != null && contextElement.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : contextElement.getAsJsonObject().entrySet()) {
                if (entry.getValue().isJsonPrimitive())
                    context.put(entry.getKey(), entry.getValue().getAsString());
                else
                    LOG.debug("Ignoring context entry {} that is no plain namespace", entry.getKey());
            }
        }

        NodeStore store = new NodeStore();
        JsonElement graphElement = memberOf(object, GRAPH);
        if (graphElement != null) {
            if (!graphElement.isJsonArray())
                throw new GraphDocumentException("graph must be a JSON array");
            for (JsonElement element : graphElement.getAsJsonArray())
                readNode(element, store);
        }
        store.clearActivity();
        return GraphDocument.of(context, store);
    }

    private static @Nullable JsonElement memberOf(JsonObject object, String key) {
        if (object.has(key))
            return object.get(key);
        return object.get(key.substring(1));
    }

    private static void readNode(JsonElement element, NodeStore store) {
        if (!element.isJsonObject())
            throw new GraphDocumentException("graph entries must be JSON objects, found " + element);
        JsonObject object = element.getAsJsonObject();
        JsonElement idElement = object.get(ID);
        if (idElement == null || !idElement.isJsonPrimitive() || StringUtils.isBlank(idElement.getAsString()))
            throw new GraphDocumentException("graph entry without @id: " + element);
        NodeId id = NodeId.of(idElement.getAsString());

        //a node listed twice is merged like any other get-or-create
        Node node = store.getOrCreate(id, readTypes(object.get(TYPE), id));
        for (Map.Entry<String, JsonElement> member : object.entrySet()) {
            if (member.getKey().equals(ID) || member.getKey().equals(TYPE))
                continue;
            node.set(member.getKey(), readValue(member.getValue()));
        }
    }

    private static List<NodeType> readTypes(@Nullable JsonElement element, NodeId id) {
        List<NodeType> types = new ArrayList<>();
        if (element == null || element.isJsonNull())
            return types;
        if (element.isJsonPrimitive()) {
            types.add(NodeType.parse(element.getAsString()));
            return types;
        }
        if (!element.isJsonArray())
            throw new GraphDocumentException("@type must be a string or an array", id.value());
        for (JsonElement type : element.getAsJsonArray()) {
            if (!type.isJsonPrimitive())
                throw new GraphDocumentException("@type entries must be strings", id.value());
            types.add(NodeType.parse(type.getAsString()));
        }
        return types;
    }

    private static @Nullable Object readValue(JsonElement element) {
        if (element.isJsonNull())
            return null;
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean())
                return primitive.getAsBoolean();
            if (primitive.isNumber())
                return readNumber(primitive);
            return primitive.getAsString();
        }
        if (element.isJsonArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonElement e : element.getAsJsonArray())
                list.add(readValue(e));
            return list;
        }
        JsonObject object = element.getAsJsonObject();
        if (object.size() == 1 && object.has(ID) && object.get(ID).isJsonPrimitive()
                && StringUtils.isNotBlank(object.get(ID).getAsString()))
            return NodeId.of(object.get(ID).getAsString());
        return object.deepCopy();
    }

    static Number readNumber(JsonPrimitive primitive) {
        String literal = primitive.getAsString();
        if (StringUtils.containsAny(literal, '.', 'e', 'E'))
            return primitive.getAsDouble();
        long value = primitive.getAsLong();
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE)
            return (int) value;
        return value;
    }
}
