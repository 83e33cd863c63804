package io.agency.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.agency.core.workflow.StepAction;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `StepAction` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`Reason`**: `{"type":"reason","instruction":"...","agentId":"...","parameters":{...}}`.
///   `agentId` and `parameters` are omitted when absent or empty.
/// - **`InvokeTool`**: `{"type":"tool","toolName":"...","arguments":{...}}`.
/// - **`NoOp`**: `{"type":"noop"}`.
///
/// @implNote Package-private. Registered by {@link AgencyJacksonModule}.
/// @see StepActionDeserializer for the inverse operation
class StepActionSerializer extends StdSerializer<StepAction> {

    @Serial private static final long serialVersionUID = -6016475331960517735L;

    StepActionSerializer() {
        super(StepAction.class);
    }

    @Override
    public void serialize(StepAction action, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", action.kind());

        if (action instanceof StepAction.Reason reason) {
            gen.writeStringField("instruction", reason.instruction());
            if (reason.agentId() != null) {
                gen.writeStringField("agentId", reason.agentId());
            }
            if (!reason.parameters().isEmpty()) {
                provider.defaultSerializeField("parameters", reason.parameters(), gen);
            }
        } else if (action instanceof StepAction.InvokeTool tool) {
            gen.writeStringField("toolName", tool.toolName());
            provider.defaultSerializeField("arguments", tool.arguments(), gen);
        }

        gen.writeEndObject();
    }
}
