package org.snowlite.engine.server;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.snowlite.engine.project.ColumnDoc;
import org.snowlite.engine.project.CompileContext;
import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.ProjectConfig;
import org.snowlite.engine.project.TestDeclaration;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Manifest Tests")
class ManifestJsonTest {

    @Test
    @DisplayName("Scalars, nulls and escapes")
    void testScalars() {
        assertEquals("null", ManifestJson.toJson(null));
        assertEquals("42", ManifestJson.toJson(42));
        assertEquals("null", ManifestJson.toJson(Double.NaN));
        assertEquals("true", ManifestJson.toJson(true));
        assertEquals("\"a \\\"b\\\"\\n\\u0001\"", ManifestJson.toJson("a \"b\"\n\u0001"));
    }

    @Test
    @DisplayName("Maps keep insertion order and nest")
    void testNested() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("z", List.of(1, "two"));
        map.put("a", Map.of());
        map.put("t", Instant.parse("2024-01-01T00:00:00Z"));

        assertEquals("{\"z\":[1,\"two\"],\"a\":{},\"t\":\"2024-01-01T00:00:00Z\"}", ManifestJson.toJson(map));
    }

    @Test
    @DisplayName("Model nodes carry columns and their tests")
    @SuppressWarnings("unchecked")
    void testModelNode() {
        Model model = Model.builder("orders")
                .uniqueId("model.shop.orders")
                .description("One row per order")
                .columns(List.of(new ColumnDoc("id", "Primary key", "INTEGER",
                        List.of(TestDeclaration.of("unique"), TestDeclaration.of("not_null")))))
                .build();
        CompileContext ctx = CompileContext.empty(ProjectConfig.builder().projectName("shop").build())
                .withModel(model);

        Map<String, Object> manifest = new ManifestGenerator().generate(ctx, Instant.EPOCH);

        Map<String, Object> node = (Map<String, Object>) ((Map<String, Object>) manifest.get("nodes"))
                .get("model.shop.orders");
        assertEquals("view", node.get("materialization"));
        assertEquals("One row per order", node.get("description"));
        Map<String, Object> id = (Map<String, Object>) ((Map<String, Object>) node.get("columns")).get("id");
        assertEquals("INTEGER", id.get("data_type"));
        assertEquals(List.of("unique", "not_null"), id.get("tests"));
        assertEquals(Map.of(), manifest.get("metrics"));
    }
}
