package io.agency.adapter.langchain4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.agency.core.agent.Agent;
import io.agency.core.agent.AgentConfig;
import io.agency.core.agent.AgentResponse;
import io.agency.core.tool.ToolDefinition;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link Agent}.
///
/// Wraps a {@link ChatModel}. Each call sends the agent's system prompt and the
/// reasoning prompt as one request, offering the registered tools as tool
/// specifications. A reply carrying tool execution requests becomes an
/// {@link AgentResponse.ToolRequest} for the first of them; a text reply
/// becomes the final answer.
///
/// Provider failures are classified, never thrown: rate limits, timeouts and
/// other retriable LangChain4j exceptions map to transient error types, the
/// rest to `UNKNOWN`.
///
/// @implNote Thread-safe. The agent keeps no conversation history; the
/// reasoning loop replays the trajectory in every prompt.
///
/// @see LangChain4jProvider for agent creation
public class LangChain4jAgent implements Agent {

    private static final Logger logger = Logger.getLogger(LangChain4jAgent.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE =
            new TypeReference<>() {};

    private final String id;
    private final AgentConfig config;
    private final ChatModel model;

    /// Creates a new agent wrapping the given chat model.
    ///
    /// @param id unique agent identifier, not null
    /// @param config agent configuration, not null
    /// @param model the LangChain4j chat model to delegate to, not null
    public LangChain4jAgent(String id, AgentConfig config, ChatModel model) {
        this.id = id;
        this.config = config;
        this.model = model;
    }

    @Override
    public AgentResponse execute(String prompt, Map<String, Object> context) {
        return execute(prompt, context, List.of());
    }

    /// Executes the prompt against the underlying chat model.
    ///
    /// @param prompt the full reasoning prompt, not null
    /// @param context step context, not null
    /// @param tools tools offered to the model, not null (may be empty)
    /// @return final answer, tool request or classified error; never null
    @Override
    public AgentResponse execute(
            String prompt, Map<String, Object> context, List<ToolDefinition> tools) {
        Instant startTime = Instant.now();

        ChatResponse response;
        try {
            ChatRequest.Builder request = ChatRequest.builder().messages(buildMessages(prompt));
            if (!tools.isEmpty()) {
                request.toolSpecifications(toSpecifications(tools));
            }
            response = model.chat(request.build());
        } catch (RuntimeException e) {
            AgentResponse.Error error = classify(e);
            logger.warning(
                    "Agent '" + id + "' call failed (" + error.errorType() + "): " + error.message());
            return error;
        }

        if (response == null || response.aiMessage() == null) {
            return AgentResponse.Error.of(
                    "No response from model", AgentResponse.Error.ErrorType.MALFORMED_RESPONSE);
        }

        AiMessage aiMessage = response.aiMessage();
        if (aiMessage.hasToolExecutionRequests()) {
            return toToolRequest(aiMessage);
        }
        if (aiMessage.text() == null) {
            return AgentResponse.Error.of(
                    "Model returned neither text nor a tool call",
                    AgentResponse.Error.ErrorType.MALFORMED_RESPONSE);
        }

        logger.fine("Agent '" + id + "' completed successfully");
        return AgentResponse.TextResponse.of(aiMessage.text(), buildMetadata(response, startTime));
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AgentConfig getConfig() {
        return config;
    }

    private List<ChatMessage> buildMessages(String prompt) {
        List<ChatMessage> messages = new ArrayList<>();
        String systemPrompt = config.getSystemPrompt();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(prompt));
        return messages;
    }

    private AgentResponse toToolRequest(AiMessage aiMessage) {
        List<ToolExecutionRequest> requests = aiMessage.toolExecutionRequests();
        if (requests.size() > 1) {
            logger.fine(
                    "Agent '"
                            + id
                            + "' requested "
                            + requests.size()
                            + " tools; only the first is run this iteration");
        }
        ToolExecutionRequest request = requests.get(0);
        try {
            String json = request.arguments();
            Map<String, Object> arguments = new HashMap<>();
            if (json != null && !json.isBlank()) {
                arguments.putAll(MAPPER.readValue(json, ARGUMENTS_TYPE));
            }
            arguments.values().removeIf(Objects::isNull);
            return AgentResponse.ToolRequest.of(request.name(), arguments, aiMessage.text());
        } catch (JsonProcessingException e) {
            return AgentResponse.Error.of(
                    "Malformed arguments for tool '" + request.name() + "': " + e.getOriginalMessage(),
                    AgentResponse.Error.ErrorType.MALFORMED_RESPONSE);
        }
    }

    static List<ToolSpecification> toSpecifications(List<ToolDefinition> tools) {
        List<ToolSpecification> specifications = new ArrayList<>(tools.size());
        for (ToolDefinition tool : tools) {
            JsonObjectSchema.Builder parameters = JsonObjectSchema.builder();
            for (ToolDefinition.ParameterDef parameter : tool.parameters()) {
                String description = parameter.description();
                switch (parameter.type() == null ? "string" : parameter.type()) {
                    case "integer" -> parameters.addIntegerProperty(parameter.name(), description);
                    case "number" -> parameters.addNumberProperty(parameter.name(), description);
                    case "boolean" -> parameters.addBooleanProperty(parameter.name(), description);
                    default -> parameters.addStringProperty(parameter.name(), description);
                }
            }
            parameters.required(tool.requiredParameterNames());
            specifications.add(
                    ToolSpecification.builder()
                            .name(tool.name())
                            .description(tool.description())
                            .parameters(parameters.build())
                            .build());
        }
        return specifications;
    }

    static AgentResponse.Error classify(RuntimeException e) {
        if (e instanceof RateLimitException) {
            return AgentResponse.Error.from(e, AgentResponse.Error.ErrorType.RATE_LIMITED);
        }
        if (e instanceof TimeoutException) {
            return AgentResponse.Error.from(e, AgentResponse.Error.ErrorType.TIMEOUT);
        }
        if (e instanceof RetriableException) {
            return AgentResponse.Error.from(e, AgentResponse.Error.ErrorType.UNAVAILABLE);
        }
        return AgentResponse.Error.from(e, AgentResponse.Error.ErrorType.UNKNOWN);
    }

    private Map<String, Object> buildMetadata(ChatResponse response, Instant startTime) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("agent_id", id);
        metadata.put("model", config.getModel());
        metadata.put("duration_ms", Duration.between(startTime, Instant.now()).toMillis());

        if (response.metadata() != null) {
            var tokenUsage = response.metadata().tokenUsage();
            if (tokenUsage != null) {
                putIfPresent(metadata, "input_tokens", tokenUsage.inputTokenCount());
                putIfPresent(metadata, "output_tokens", tokenUsage.outputTokenCount());
                putIfPresent(metadata, "total_tokens", tokenUsage.totalTokenCount());
            }
            var finishReason = response.metadata().finishReason();
            if (finishReason != null) {
                metadata.put("finish_reason", finishReason.toString());
            }
        }
        return metadata;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
