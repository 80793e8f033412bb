package com.ttennebkram.imagerouter.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.ConverterEntry;
import com.ttennebkram.imagerouter.registry.OperationEntry;
import com.ttennebkram.imagerouter.routing.CapabilityGraph;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Exports a capability graph as JSON for inspection.
 *
 * Format:
 * <pre>
 * {
 *   "generation": 42,
 *   "nodes": [
 *     {"id": 0, "name": "awt-image", "valueType": "java.awt.image.BufferedImage",
 *      "operations": [{"name": "resize", "arguments": "(Integer, Integer)", "backend": "awt"}]}
 *   ],
 *   "converters": [
 *     {"sourceId": 1, "targetId": 0, "source": "png-file", "target": "awt-image", "cost": 100, "backend": "awt"}
 *   ]
 * }
 * </pre>
 * Node ids are positions in the graph's node order; converters are listed in registration order.
 */
public class CapabilityGraphSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private CapabilityGraphSerializer() {
    }

    public static JsonObject toJsonObject(CapabilityGraph graph) {
        JsonObject root = new JsonObject();
        root.addProperty("generation", graph.getGeneration());

        // Representations compare by identity
        Map<Representation<?>, Integer> ids = new IdentityHashMap<>();
        JsonArray nodesArray = new JsonArray();
        for (Representation<?> node : graph.getNodes()) {
            int id = ids.size();
            ids.put(node, id);

            JsonObject nodeJson = new JsonObject();
            nodeJson.addProperty("id", id);
            nodeJson.addProperty("name", node.getName());
            nodeJson.addProperty("valueType", node.getValueType().getName());

            JsonArray operations = new JsonArray();
            for (String name : graph.operationsFor(node)) {
                graph.lookupOperation(node, name).ifPresent(entry -> operations.add(operationJson(entry)));
            }
            nodeJson.add("operations", operations);
            nodesArray.add(nodeJson);
        }
        root.add("nodes", nodesArray);

        JsonArray convertersArray = new JsonArray();
        for (ConverterEntry<?, ?> edge : graph.getEdges()) {
            JsonObject edgeJson = new JsonObject();
            edgeJson.addProperty("sourceId", ids.get(edge.getSource()));
            edgeJson.addProperty("targetId", ids.get(edge.getTarget()));
            edgeJson.addProperty("source", edge.getSource().getName());
            edgeJson.addProperty("target", edge.getTarget().getName());
            edgeJson.addProperty("cost", edge.getCost());
            edgeJson.addProperty("backend", edge.getBackend());
            convertersArray.add(edgeJson);
        }
        root.add("converters", convertersArray);
        return root;
    }

    public static String toJson(CapabilityGraph graph) {
        return GSON.toJson(toJsonObject(graph));
    }

    public static void write(CapabilityGraph graph, Writer writer) throws IOException {
        GSON.toJson(toJsonObject(graph), writer);
        writer.flush();
    }

    /**
     * Save the graph to a JSON file.
     */
    public static void save(CapabilityGraph graph, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(graph, writer);
        }
    }

    private static JsonObject operationJson(OperationEntry<?> entry) {
        JsonObject json = new JsonObject();
        json.addProperty("name", entry.getName());
        json.addProperty("arguments", entry.getShape().toString());
        json.addProperty("backend", entry.getBackend());
        return json;
    }
}
