package io.agency.core.agent;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Sealed hierarchy of model responses.
///
/// - {@link TextResponse}: final answer
/// - {@link ToolRequest}: the model asks for a tool call
/// - {@link Error}: the call failed
///
/// ### Usage
/// {@snippet :
/// AgentResponse response = agent.execute(prompt, context);
/// if (response instanceof AgentResponse.TextResponse text) {
///     return text.content();
/// }
/// }
///
/// @see Agent#execute
public sealed interface AgentResponse
        permits AgentResponse.TextResponse, AgentResponse.ToolRequest, AgentResponse.Error {

    /// Returns when this response was created.
    Instant timestamp();

    /// Final answer from the model.
    ///
    /// @param content the answer text, not null
    /// @param metadata execution metadata (tokens, model), not null
    /// @param timestamp when the response was created, not null
    record TextResponse(String content, Map<String, Object> metadata, Instant timestamp)
            implements AgentResponse {

        public TextResponse {
            Objects.requireNonNull(content, "content must not be null");
            metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static TextResponse of(String content) {
            return new TextResponse(content, Map.of(), Instant.now());
        }

        public static TextResponse of(String content, Map<String, Object> metadata) {
            return new TextResponse(content, metadata, Instant.now());
        }
    }

    /// The model asks to invoke a tool before answering.
    ///
    /// @param toolName the tool to invoke, not null
    /// @param arguments tool arguments, not null
    /// @param reasoning the model's explanation, never null (may be empty)
    /// @param timestamp when the response was created, not null
    record ToolRequest(
            String toolName, Map<String, Object> arguments, String reasoning, Instant timestamp)
            implements AgentResponse {

        public ToolRequest {
            Objects.requireNonNull(toolName, "toolName must not be null");
            arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
            reasoning = reasoning != null ? reasoning : "";
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static ToolRequest of(String toolName, Map<String, Object> arguments) {
            return new ToolRequest(toolName, arguments, "", Instant.now());
        }

        public static ToolRequest of(
                String toolName, Map<String, Object> arguments, String reasoning) {
            return new ToolRequest(toolName, arguments, reasoning, Instant.now());
        }
    }

    /// The model call failed.
    ///
    /// @param message error description, not null
    /// @param errorType classification of the error, not null
    /// @param cause the underlying exception, may be null
    /// @param timestamp when the error occurred, not null
    record Error(String message, ErrorType errorType, Throwable cause, Instant timestamp)
            implements AgentResponse {

        public enum ErrorType {
            TOOL_NOT_FOUND,
            INVALID_ARGUMENTS,
            TIMEOUT,
            RATE_LIMITED,
            UNAVAILABLE,
            MALFORMED_RESPONSE,
            UNKNOWN;

            /// Returns whether repeating the same call may succeed.
            ///
            /// @return `true` for `TIMEOUT`, `RATE_LIMITED` and `UNAVAILABLE`
            public boolean isTransient() {
                return this == TIMEOUT || this == RATE_LIMITED || this == UNAVAILABLE;
            }
        }

        public Error {
            Objects.requireNonNull(message, "message must not be null");
            errorType = errorType != null ? errorType : ErrorType.UNKNOWN;
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Error from(Throwable cause) {
            return from(cause, ErrorType.UNKNOWN);
        }

        public static Error from(Throwable cause, ErrorType type) {
            return new Error(
                    cause.getMessage() != null
                            ? cause.getMessage()
                            : cause.getClass().getSimpleName(),
                    type,
                    cause,
                    Instant.now());
        }

        public static Error of(String message) {
            return new Error(message, ErrorType.UNKNOWN, null, Instant.now());
        }

        public static Error of(String message, ErrorType type) {
            return new Error(message, type, null, Instant.now());
        }

        public boolean isTransient() {
            return errorType.isTransient();
        }
    }
}
