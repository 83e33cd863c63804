package io.agency.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.agency.core.workflow.StepAction;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Deserializes the `StepAction` sealed hierarchy using a `"type"` discriminator field.
///
/// Subtypes are constructed directly from `JsonNode` values:
/// - **`"reason"`** requires `instruction`; `agentId` and `parameters` are optional
/// - **`"tool"`** requires `toolName`; `arguments` is optional
/// - **`"noop"`** has no fields
///
/// @implNote Package-private. Registered by {@link AgencyJacksonModule}.
/// @see StepActionSerializer for the inverse operation
class StepActionDeserializer extends StdDeserializer<StepAction> {

    @Serial private static final long serialVersionUID = 2203618402446470961L;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    StepActionDeserializer() {
        super(StepAction.class);
    }

    /// Reads the `"type"` field and dispatches to the matching subtype constructor.
    ///
    /// @throws IOException if the type is missing or unknown, or a required field is absent
    @Override
    public StepAction deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode typeNode = root.get("type");
        if (typeNode == null || typeNode.isNull()) {
            throw JsonMappingException.from(p, "Step action has no type");
        }
        String type = typeNode.asText();

        switch (type) {
            case "reason":
                return new StepAction.Reason(
                        required(p, root, "instruction", type),
                        optionalText(root, "agentId"),
                        optionalMap(mapper, root, "parameters"));
            case "tool":
                return new StepAction.InvokeTool(
                        required(p, root, "toolName", type), optionalMap(mapper, root, "arguments"));
            case "noop":
                return StepAction.NoOp.of();
            default:
                throw JsonMappingException.from(p, "Unknown step action type: " + type);
        }
    }

    private static String required(JsonParser p, JsonNode root, String field, String type)
            throws JsonMappingException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw JsonMappingException.from(
                    p, "Step action '" + type + "' requires '" + field + "'");
        }
        return node.asText();
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Map<String, Object> optionalMap(ObjectMapper mapper, JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? Map.of() : mapper.convertValue(node, MAP_TYPE);
    }
}
