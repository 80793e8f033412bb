package com.ttennebkram.imagerouter.serialization;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.ArgumentShape;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link CapabilityGraphSerializer}.
 */
class CapabilityGraphSerializerTest {

    private static final Representation<String> FILE = Representation.of("file", String.class);
    private static final Representation<StringBuilder> DECODED = Representation.of("decoded", StringBuilder.class);

    private CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
        registry.registerBackend("text", r -> {
            r.registerConverter(FILE, DECODED, 40, StringBuilder::new);
            r.registerOperation(DECODED, "resize", ArgumentShape.of(int.class, int.class), (value, args) -> value);
        });
    }

    @Test
    @DisplayName("nodes and converters are exported with ids")
    void exportsGraph() {
        JsonObject root = JsonParser.parseString(CapabilityGraphSerializer.toJson(registry.getGraph()))
            .getAsJsonObject();

        JsonArray nodes = root.getAsJsonArray("nodes");
        assertEquals(2, nodes.size());
        JsonObject decoded = nodes.get(0).getAsJsonObject();
        assertEquals("decoded", decoded.get("name").getAsString());
        assertEquals(StringBuilder.class.getName(), decoded.get("valueType").getAsString());
        JsonObject resize = decoded.getAsJsonArray("operations").get(0).getAsJsonObject();
        assertEquals("resize", resize.get("name").getAsString());
        assertEquals("text", resize.get("backend").getAsString());

        JsonArray converters = root.getAsJsonArray("converters");
        assertEquals(1, converters.size());
        JsonObject edge = converters.get(0).getAsJsonObject();
        assertEquals(1, edge.get("sourceId").getAsInt());
        assertEquals(0, edge.get("targetId").getAsInt());
        assertEquals(40, edge.get("cost").getAsInt());
        assertEquals("text", edge.get("backend").getAsString());
    }

    @Test
    @DisplayName("save writes the same JSON to a file")
    void saveToFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("graph.json");

        CapabilityGraphSerializer.save(registry.getGraph(), file);

        String written = Files.readString(file, StandardCharsets.UTF_8);
        assertEquals(JsonParser.parseString(CapabilityGraphSerializer.toJson(registry.getGraph())),
            JsonParser.parseString(written));
    }
}
