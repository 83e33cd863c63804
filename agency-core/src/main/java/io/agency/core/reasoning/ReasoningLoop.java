package io.agency.core.reasoning;

import io.agency.core.AgencyConfig;
import io.agency.core.agent.Agent;
import io.agency.core.agent.AgentRegistry;
import io.agency.core.agent.AgentResponse;
import io.agency.core.exception.AgencyException;
import io.agency.core.exception.TransientException;
import io.agency.core.exception.TransientProviderException;
import io.agency.core.exception.UnrecoverableException;
import io.agency.core.memory.MemoryEntry;
import io.agency.core.memory.MemoryStore;
import io.agency.core.tool.ToolDefinition;
import io.agency.core.tool.ToolInvoker;
import io.agency.core.tool.ToolRegistry;
import io.agency.core.workflow.StepAction;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Bounded think/act/observe cycle that produces the result of one reasoning action.
///
/// Each iteration builds a prompt from the action, the trajectory so far and
/// optionally fetched memory, then consults the model. A final answer ends the
/// loop. A tool-call request is executed (or refused when tools are disabled)
/// and its observation is appended before the next iteration. The loop never
/// consults the model more than `maxThinkingSteps` times; reaching the bound
/// returns the best partial answer tagged as truncated.
///
/// ### Error Handling
/// Transient model and tool failures are retried within the same iteration by
/// the {@link RetryPolicy}. Permanent failures and exhausted budgets end the
/// loop with {@link TerminationReason#UNRECOVERABLE_ERROR}.
///
/// ### Contracts
/// - **Postcondition**: at most `maxThinkingSteps` iterations are recorded
/// - **Postcondition**: never throws for collaborator failures; they are reported in the result
/// - **Invariant**: never touches step state; the caller records the result
///
/// @implNote Thread-safe. All per-run state lives on the calling thread's stack,
/// so steps of different workflows may run through one instance concurrently.
///
/// @see io.agency.core.execution.ActionRunner
public class ReasoningLoop {

    private static final Logger logger = Logger.getLogger(ReasoningLoop.class.getName());

    private final AgentRegistry agentRegistry;
    private final ToolRegistry toolRegistry;
    private final ToolInvoker toolInvoker;
    private final MemoryStore memoryStore;
    private final AgencyConfig config;
    private final RetryPolicy retryPolicy;
    private final PromptBuilder promptBuilder = new PromptBuilder();

    public ReasoningLoop(
            AgentRegistry agentRegistry,
            ToolRegistry toolRegistry,
            ToolInvoker toolInvoker,
            MemoryStore memoryStore,
            AgencyConfig config,
            RetryPolicy retryPolicy) {
        this.agentRegistry = Objects.requireNonNull(agentRegistry, "agentRegistry must not be null");
        this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry must not be null");
        this.toolInvoker = Objects.requireNonNull(toolInvoker, "toolInvoker must not be null");
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    /// Runs the loop for one action.
    ///
    /// @param action the reasoning action, not null
    /// @param context step context (workflow id, step name), not null
    /// @param maxThinkingSteps iteration bound, at least 1
    /// @return the loop result, never null
    public ReasoningResult run(
            StepAction.Reason action, Map<String, Object> context, int maxThinkingSteps) {
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(context, "context must not be null");
        if (maxThinkingSteps < 1) {
            throw new IllegalArgumentException("maxThinkingSteps must be at least 1");
        }

        Trajectory trajectory = new Trajectory();
        RetryTracker tracker = new RetryTracker();
        String agentId = action.agentId() != null ? action.agentId() : config.getAgentName();

        Agent agent;
        try {
            agent = agentRegistry.getAgentOrThrow(agentId);
        } catch (AgencyException e) {
            return ReasoningResult.unrecoverable(e.getMessage(), trajectory, 0);
        }

        boolean toolsEnabled = config.isUseTools();
        List<ToolDefinition> tools = toolsEnabled ? toolRegistry.definitions() : List.of();

        for (int iteration = 1; iteration <= maxThinkingSteps; iteration++) {
            List<MemoryEntry> memory = fetchMemory(action.instruction());
            String prompt = promptBuilder.build(action, trajectory, memory, toolsEnabled);

            Map<String, Object> callContext = new HashMap<>(context);
            callContext.put("iteration", iteration);

            AgentResponse response;
            try {
                response = callModel(agent, prompt, callContext, tools, tracker);
            } catch (RuntimeException e) {
                logger.warning("Reasoning stopped at iteration " + iteration + ": " + e.getMessage());
                return ReasoningResult.unrecoverable(e.getMessage(), trajectory, tracker.retries());
            }

            if (response instanceof AgentResponse.TextResponse text) {
                trajectory.append(new Iteration(iteration, prompt, text.content(), null, null, null));
                rememberAnswer(action, context, text.content());
                logger.fine("Final answer after " + iteration + " iteration(s)");
                return ReasoningResult.finalAnswer(text.content(), trajectory, tracker.retries());
            }

            AgentResponse.ToolRequest request = (AgentResponse.ToolRequest) response;
            String observation;
            if (!toolsEnabled) {
                observation = "Tool calls are disabled. Answer without using tools.";
            } else {
                try {
                    observation =
                            retryPolicy.execute(
                                    "Tool '" + request.toolName() + "'",
                                    () -> toolInvoker.invoke(request.toolName(), request.arguments()),
                                    tracker);
                } catch (RuntimeException e) {
                    logger.warning("Tool call failed permanently: " + e.getMessage());
                    return ReasoningResult.unrecoverable(
                            e.getMessage(), trajectory, tracker.retries());
                }
            }
            trajectory.append(
                    new Iteration(
                            iteration,
                            prompt,
                            request.reasoning(),
                            request.toolName(),
                            request.arguments(),
                            observation));
            logger.fine("Iteration " + iteration + " observed tool '" + request.toolName() + "'");
        }

        logger.info(
                "Reasoning reached the limit of "
                        + maxThinkingSteps
                        + " thinking steps; returning a truncated answer");
        return ReasoningResult.stepLimitReached(trajectory, tracker.retries());
    }

    private AgentResponse callModel(
            Agent agent,
            String prompt,
            Map<String, Object> context,
            List<ToolDefinition> tools,
            RetryTracker tracker) {
        return retryPolicy.execute(
                "Model call to agent '" + agent.getId() + "'",
                () -> {
                    AgentResponse response;
                    try {
                        response = agent.execute(prompt, context, tools);
                    } catch (TransientException | UnrecoverableException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        throw new UnrecoverableException("Model call failed: " + e.getMessage(), e);
                    }
                    if (response == null) {
                        throw new UnrecoverableException("Model returned no response");
                    }
                    if (response instanceof AgentResponse.Error error) {
                        if (error.isTransient()) {
                            throw new TransientProviderException(error.message(), error.cause());
                        }
                        throw new UnrecoverableException(
                                "Model error (" + error.errorType() + "): " + error.message(),
                                error.cause());
                    }
                    return response;
                },
                tracker);
    }

    private List<MemoryEntry> fetchMemory(String query) {
        if (!config.isUseMemory()) {
            return List.of();
        }
        try {
            return memoryStore.fetchContext(query, config.getMaxMemoryResults());
        } catch (RuntimeException e) {
            logger.warning("Memory lookup failed, continuing without context: " + e.getMessage());
            return List.of();
        }
    }

    private void rememberAnswer(StepAction.Reason action, Map<String, Object> context, String answer) {
        if (!config.isUseMemory()) {
            return;
        }
        Map<String, String> metadata = new HashMap<>();
        context.forEach(
                (key, value) -> {
                    if (value != null && ("workflow_id".equals(key) || "step".equals(key))) {
                        metadata.put(key, value.toString());
                    }
                });
        try {
            memoryStore.storeObservation(
                    "User: " + action.instruction() + "\nAssistant: " + answer, metadata);
        } catch (RuntimeException e) {
            logger.warning("Failed to store observation in memory: " + e.getMessage());
        }
    }
}
