package io.fetchbox.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fetchbox.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class TaskTest {

    @Test
    void attributesCannotBeChangedThroughTheAccessor() {
        ObjectNode source = Jsons.mapper().createObjectNode();
        source.put("priority", "high");
        Task task = new Task("r1", "job", "", "http://example.test/1", List.of(), null, null, Map.of(), source, "");

        source.put("priority", "low");
        Assertions.assertEquals("high", task.attributes().path("priority").asText());

        ((ObjectNode) task.attributes()).put("priority", "changed");
        ((ObjectNode) task.attributes()).put("extra", true);
        JsonNode attributes = task.attributes();
        Assertions.assertEquals("high", attributes.path("priority").asText());
        Assertions.assertFalse(attributes.has("extra"));
    }

    @Test
    void serializedTaskKeepsOriginalAttributes() throws Exception {
        ObjectNode source = Jsons.mapper().createObjectNode();
        source.put("depth", 2);
        Task task = new Task("r1", "job", "", "http://example.test/1", List.of(), null, null, Map.of(), source, "");
        ((ObjectNode) task.attributes()).put("depth", 99);

        Task decoded = Jsons.mapper().readValue(Jsons.toCompactJson(task), Task.class);
        Assertions.assertEquals(2, decoded.attributes().path("depth").asInt());
        Assertions.assertEquals(task, decoded);
    }

    @Test
    void missingAttributesStayNull() {
        Assertions.assertNull(Task.of("r1", "job", "http://example.test/1").attributes());
    }
}
