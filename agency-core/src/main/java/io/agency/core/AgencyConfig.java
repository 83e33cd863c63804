package io.agency.core;

import java.time.Duration;

/// Configuration options for the workflow engine.
///
/// ### Default Values
/// - `memoryPersistent`: `false` (ephemeral memory)
/// - `useMemory`: `true`
/// - `useTools`: `true`
/// - `maxThinkingSteps`: `10`
/// - `enableSuspendResume`: `true`
/// - `resumeInterruptedOnStartup`: `true`
/// - `retryBudget`: `3` attempts per model or tool call
/// - `retryBaseDelay`: `100ms`, doubled after every attempt
/// - `maxMemoryResults`: `5`
/// - `threadPoolSize`: `8`
/// - `agentName`: `"assistant"`, `agentModel`: `"stub"`
/// - `snapshotRetention`: `7 days` for terminal workflows
/// - `shutdownTimeout`: `30s`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link AgencyFactory};
/// do not modify after environment creation.
///
/// @see AgencyFactory#createEnvironment(AgencyConfig)
/// @see Builder
public class AgencyConfig {
    private boolean memoryPersistent = false;
    private boolean useMemory = true;
    private boolean useTools = true;
    private int maxThinkingSteps = 10;
    private boolean enableSuspendResume = true;
    private boolean resumeInterruptedOnStartup = true;
    private int retryBudget = 3;
    private Duration retryBaseDelay = Duration.ofMillis(100);
    private int maxMemoryResults = 5;
    private int threadPoolSize = 8;
    private String agentName = "assistant";
    private String agentModel = "stub";
    private String systemPrompt;
    private Duration snapshotRetention = Duration.ofDays(7);
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    public AgencyConfig() {}

    /// Returns whether the memory collaborator keeps observations across restarts.
    ///
    /// @return `true` for durable memory, `false` for in-process memory
    public boolean isMemoryPersistent() {
        return memoryPersistent;
    }

    public void setMemoryPersistent(boolean memoryPersistent) {
        this.memoryPersistent = memoryPersistent;
    }

    /// Returns whether the reasoning loop may fetch and store memory.
    public boolean isUseMemory() {
        return useMemory;
    }

    public void setUseMemory(boolean useMemory) {
        this.useMemory = useMemory;
    }

    /// Returns whether the reasoning loop may execute tool calls the model requests.
    public boolean isUseTools() {
        return useTools;
    }

    public void setUseTools(boolean useTools) {
        this.useTools = useTools;
    }

    /// Returns the default reasoning iteration bound per action.
    ///
    /// @return bound used when a caller does not supply one, at least 1
    public int getMaxThinkingSteps() {
        return maxThinkingSteps;
    }

    public void setMaxThinkingSteps(int maxThinkingSteps) {
        this.maxThinkingSteps = maxThinkingSteps;
    }

    /// Returns whether suspend and resume are allowed.
    ///
    /// When `false`, both operations are rejected and workflows interrupted by a
    /// crash are abandoned at startup.
    public boolean isEnableSuspendResume() {
        return enableSuspendResume;
    }

    public void setEnableSuspendResume(boolean enableSuspendResume) {
        this.enableSuspendResume = enableSuspendResume;
    }

    public boolean isResumeInterruptedOnStartup() {
        return resumeInterruptedOnStartup;
    }

    public void setResumeInterruptedOnStartup(boolean resumeInterruptedOnStartup) {
        this.resumeInterruptedOnStartup = resumeInterruptedOnStartup;
    }

    /// Returns the number of attempts allowed for one model or tool call,
    /// counting the first.
    public int getRetryBudget() {
        return retryBudget;
    }

    public void setRetryBudget(int retryBudget) {
        this.retryBudget = retryBudget;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public int getMaxMemoryResults() {
        return maxMemoryResults;
    }

    public void setMaxMemoryResults(int maxMemoryResults) {
        this.maxMemoryResults = maxMemoryResults;
    }

    /// Returns the size of the pool that runs workflows in the background.
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Returns the id of the default agent used by reasoning steps that name none.
    public String getAgentName() {
        return agentName;
    }

    public void setAgentName(String agentName) {
        this.agentName = agentName;
    }

    public String getAgentModel() {
        return agentModel;
    }

    public void setAgentModel(String agentModel) {
        this.agentModel = agentModel;
    }

    /// Returns the system prompt of the default agent.
    ///
    /// @return prompt text, may be null
    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    /// Returns how long terminal workflows keep their snapshots.
    public Duration getSnapshotRetention() {
        return snapshotRetention;
    }

    public void setSnapshotRetention(Duration snapshotRetention) {
        this.snapshotRetention = snapshotRetention;
    }

    /// Returns how long closing the environment waits for running workflows
    /// to reach a step boundary.
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link AgencyConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final AgencyConfig config = new AgencyConfig();

        public Builder memoryPersistent(boolean memoryPersistent) {
            config.memoryPersistent = memoryPersistent;
            return this;
        }

        public Builder useMemory(boolean useMemory) {
            config.useMemory = useMemory;
            return this;
        }

        public Builder useTools(boolean useTools) {
            config.useTools = useTools;
            return this;
        }

        /// Sets the default reasoning iteration bound.
        ///
        /// @param maxThinkingSteps the bound, must be at least 1
        /// @return this builder for chaining, never null
        public Builder maxThinkingSteps(int maxThinkingSteps) {
            config.maxThinkingSteps = maxThinkingSteps;
            return this;
        }

        public Builder enableSuspendResume(boolean enableSuspendResume) {
            config.enableSuspendResume = enableSuspendResume;
            return this;
        }

        public Builder resumeInterruptedOnStartup(boolean resumeInterruptedOnStartup) {
            config.resumeInterruptedOnStartup = resumeInterruptedOnStartup;
            return this;
        }

        /// Sets the attempts allowed per model or tool call.
        ///
        /// @param retryBudget attempts including the first, must be at least 1
        /// @return this builder for chaining, never null
        public Builder retryBudget(int retryBudget) {
            config.retryBudget = retryBudget;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            config.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder maxMemoryResults(int maxMemoryResults) {
            config.maxMemoryResults = maxMemoryResults;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder agentName(String agentName) {
            config.agentName = agentName;
            return this;
        }

        public Builder agentModel(String agentModel) {
            config.agentModel = agentModel;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            config.systemPrompt = systemPrompt;
            return this;
        }

        public Builder snapshotRetention(Duration snapshotRetention) {
            config.snapshotRetention = snapshotRetention;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            config.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public AgencyConfig build() {
            return config;
        }
    }
}
