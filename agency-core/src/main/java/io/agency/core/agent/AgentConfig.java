package io.agency.core.agent;

import java.util.Objects;

/// Immutable configuration for an agent.
///
/// ### Required Fields
/// - `id` - registry key
/// - `model` - model identifier (e.g. "claude-sonnet-4", "gpt-4o", "stub")
///
/// ### Optional Parameters
/// - `systemPrompt` - system-level instructions
/// - `temperature` - sampling temperature (default: 0.7)
/// - `maxTokens` - response token limit
/// - `timeout` - request timeout in milliseconds
///
/// @implNote Thread-safe. All fields are immutable after construction.
///
/// @see AgentFactory
public final class AgentConfig {

    private final String id;
    private final String model;
    private final String systemPrompt;
    private final double temperature;
    private final Integer maxTokens;
    private final Long timeout;

    private AgentConfig(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Agent ID required");
        this.model = Objects.requireNonNull(builder.model, "Model required");
        this.systemPrompt = builder.systemPrompt;
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.timeout = builder.timeout;
    }

    public String getId() {
        return id;
    }

    public String getModel() {
        return model;
    }

    /// Returns system-level instructions for the agent.
    ///
    /// @return instruction text, may be null
    public String getSystemPrompt() {
        return systemPrompt;
    }

    public double getTemperature() {
        return temperature;
    }

    /// Returns the maximum number of tokens in the response.
    ///
    /// @return max tokens limit, may be null (provider default used)
    public Integer getMaxTokens() {
        return maxTokens;
    }

    /// Returns the request timeout in milliseconds.
    ///
    /// @return timeout value, may be null (provider default used)
    public Long getTimeout() {
        return timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link AgentConfig}.
    ///
    /// @implNote Not thread-safe.
    public static final class Builder {
        private String id;
        private String model;
        private String systemPrompt;
        private double temperature = 0.7;
        private Integer maxTokens;
        private Long timeout;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        /// Sets the request timeout.
        ///
        /// @param timeout timeout in milliseconds, may be null
        /// @return this builder for chaining
        public Builder timeout(Long timeout) {
            this.timeout = timeout;
            return this;
        }

        /// Builds an immutable AgentConfig instance.
        ///
        /// @return the constructed configuration, never null
        /// @throws NullPointerException if id or model is null
        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentConfig that)) return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AgentConfig{id='" + id + "', model='" + model + "'}";
    }
}
