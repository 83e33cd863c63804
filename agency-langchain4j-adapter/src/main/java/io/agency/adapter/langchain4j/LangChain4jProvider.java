package io.agency.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.agency.core.agent.Agent;
import io.agency.core.agent.AgentConfig;
import io.agency.core.agent.spi.AgentProvider;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link AgentProvider}.
///
/// Creates {@link ChatModel} instances by model-name prefix and wraps them in
/// {@link LangChain4jAgent}:
/// - `claude*`: Anthropic, key `ANTHROPIC_API_KEY`
/// - `gpt*`, `o1*`, `o3*`, `o4*`: OpenAI, key `OPENAI_API_KEY`
/// - `deepseek*`: OpenAI-compatible API at `https://api.deepseek.com`, key `DEEPSEEK_API_KEY`
/// - `gemini*`, `gemma*`: Google AI, key `GOOGLE_API_KEY`
///
/// Keys are looked up in the credentials map, lowercase name first.
///
/// @implNote Stateless and thread-safe. Each call to {@link #createAgent} creates
/// a new model instance.
///
/// @see LangChain4jAgent for the agent implementation
public class LangChain4jProvider implements AgentProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jProvider.class.getName());

    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final long DEFAULT_TIMEOUT_MILLIS = 60_000;

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelName) {
        return family(modelName) != null;
    }

    @Override
    public Agent createAgent(String agentId, AgentConfig config, Map<String, String> credentials) {
        logger.info("Creating LangChain4j agent: " + agentId + " with model: " + config.getModel());
        return new LangChain4jAgent(agentId, config, createModel(config, credentials));
    }

    @Override
    public int getPriority() {
        return 100;
    }

    enum Family {
        ANTHROPIC,
        OPENAI,
        DEEPSEEK,
        GOOGLE
    }

    static Family family(String modelName) {
        if (modelName == null) {
            return null;
        }
        if (modelName.startsWith("claude")) {
            return Family.ANTHROPIC;
        }
        if (modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("o3")
                || modelName.startsWith("o4")) {
            return Family.OPENAI;
        }
        if (modelName.startsWith("deepseek")) {
            return Family.DEEPSEEK;
        }
        if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) {
            return Family.GOOGLE;
        }
        return null;
    }

    /// Creates the chat model for the configured model name.
    ///
    /// @throws IllegalArgumentException if the model name is not supported
    /// @throws IllegalStateException if the required API key is missing
    private ChatModel createModel(AgentConfig config, Map<String, String> credentials) {
        Family family = family(config.getModel());
        if (family == null) {
            throw new IllegalArgumentException("Unsupported model: " + config.getModel());
        }

        Duration timeout = Duration.ofMillis(getTimeout(config));
        return switch (family) {
            case ANTHROPIC -> AnthropicChatModel.builder()
                    .apiKey(requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY"))
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .maxTokens(getMaxTokens(config))
                    .timeout(timeout)
                    .build();
            case OPENAI -> OpenAiChatModel.builder()
                    .apiKey(requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY"))
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .maxTokens(getMaxTokens(config))
                    .timeout(timeout)
                    .build();
            case DEEPSEEK -> OpenAiChatModel.builder()
                    .baseUrl(DEEPSEEK_BASE_URL)
                    .apiKey(requireApiKey(credentials, "deepseek_api_key", "DEEPSEEK_API_KEY"))
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .maxTokens(getMaxTokens(config))
                    .timeout(timeout)
                    .build();
            case GOOGLE -> GoogleAiGeminiChatModel.builder()
                    .apiKey(requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY"))
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .maxOutputTokens(getMaxTokens(config))
                    .timeout(timeout)
                    .build();
        };
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @throws IllegalStateException if no key name resolves to a value
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private static int getMaxTokens(AgentConfig config) {
        return config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_MAX_TOKENS;
    }

    private static long getTimeout(AgentConfig config) {
        return config.getTimeout() != null ? config.getTimeout() : DEFAULT_TIMEOUT_MILLIS;
    }
}
