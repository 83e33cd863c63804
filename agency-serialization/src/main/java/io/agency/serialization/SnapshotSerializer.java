package io.agency.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.agency.core.workflow.StepDescriptor;
import io.agency.core.workflow.WorkflowSnapshot;
import java.util.List;

/// Utility class for converting workflow snapshots to and from JSON.
///
/// Provides a pre-configured `ObjectMapper` that knows the closed
/// {@link io.agency.core.workflow.StepAction} set and `java.time` types.
///
/// ### Usage
/// {@snippet :
/// String json = SnapshotSerializer.toJson(snapshot);
/// WorkflowSnapshot restored = SnapshotSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The shared mapper is immutable after configuration;
/// use {@link #createMapper()} for a private copy to customize.
///
/// @see AgencyJacksonModule for the registered type handlers
public final class SnapshotSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private SnapshotSerializer() {}

    /// Serializes a snapshot to compact JSON.
    ///
    /// @param snapshot the snapshot, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(WorkflowSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize snapshot: " + e.getMessage(), e);
        }
    }

    /// Deserializes a snapshot.
    ///
    /// @param json JSON text, not null
    /// @return the snapshot, never null
    /// @throws IllegalArgumentException if the JSON is malformed or violates a snapshot invariant
    public static WorkflowSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, WorkflowSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize snapshot: " + e.getMessage(), e);
        }
    }

    /// Deserializes a step list in the same shape snapshots use.
    ///
    /// @param json JSON array text, not null
    /// @return the steps, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static List<StepDescriptor> stepsFromJson(String json) {
        try {
            return MAPPER.readValue(json, new TypeReference<List<StepDescriptor>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize steps: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for snapshot serialization.
    ///
    /// Registers:
    /// - `AgencyJacksonModule` for the step action set
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled so older readers accept newer snapshots
    /// - Timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new AgencyJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
