package io.pluginchain.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.pluginchain.core.plugin.PluginDescriptor;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes a `PluginDescriptor` through its builder.
///
/// Only `name` and `outputTypes` are required. Absent optional fields take the builder
/// defaults (`autoChain = true`, `chainPriority = 0.5`, `category = "general"`), which a
/// plain record binding would replace with zero values.
///
/// @implNote Package-private. Registered by {@link PluginChainJacksonModule}.
class PluginDescriptorDeserializer extends StdDeserializer<PluginDescriptor> {

    @Serial private static final long serialVersionUID = 2719411406352117846L;

    PluginDescriptorDeserializer() {
        super(PluginDescriptor.class);
    }

    @Override
    public PluginDescriptor deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        if (!root.hasNonNull("name")) {
            return ctxt.reportInputMismatch(PluginDescriptor.class, "Plugin descriptor is missing 'name'");
        }

        PluginDescriptor.Builder b = PluginDescriptor.builder(root.get("name").asText())
                .inputs(strings(root, "inputTypes"))
                .outputs(strings(root, "outputTypes"))
                .collaboratesWith(strings(root, "collaboratesWith").toArray(String[]::new));
        if (root.has("autoChain")) {
            b.autoChain(root.get("autoChain").asBoolean());
        }
        if (root.has("chainPriority")) {
            b.chainPriority(root.get("chainPriority").asDouble());
        }
        if (root.hasNonNull("description")) {
            b.description(root.get("description").asText());
        }
        if (root.hasNonNull("category")) {
            b.category(root.get("category").asText());
        }

        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            return ctxt.reportInputMismatch(PluginDescriptor.class, e.getMessage());
        }
    }

    private static List<String> strings(JsonNode root, String field) {
        List<String> values = new ArrayList<>();
        JsonNode array = root.get(field);
        if (array != null && array.isArray()) {
            array.forEach(element -> values.add(element.asText()));
        }
        return values;
    }
}
