package io.agency.core.agent.stub;

import io.agency.core.agent.Agent;
import io.agency.core.agent.AgentConfig;
import io.agency.core.agent.AgentResponse;
import java.util.Map;
import java.util.logging.Logger;

/// Agent that answers from {@link StubResponseRegistry} without calling a model.
///
/// Looks up a scripted response by the current step name (`step` context key)
/// and then by its own id. Without a script it answers immediately with a
/// generated final answer echoing the start of the prompt.
///
/// @implNote Thread-safe.
///
/// @see StubAgentProvider
public class StubAgent implements Agent {

    private static final Logger logger = Logger.getLogger(StubAgent.class.getName());
    private static final int PROMPT_EXCERPT = 200;

    private final String id;
    private final AgentConfig config;
    private final StubResponseRegistry responseRegistry;

    public StubAgent(String id, AgentConfig config) {
        this.id = id;
        this.config = config;
        this.responseRegistry = StubResponseRegistry.getInstance();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AgentConfig getConfig() {
        return config;
    }

    @Override
    public AgentResponse execute(String prompt, Map<String, Object> context) {
        logger.fine("[STUB] Agent '" + id + "' received prompt (" + prompt.length() + " chars)");

        Object step = context != null ? context.get("step") : null;
        AgentResponse response =
                responseRegistry.nextResponse(step != null ? step.toString() : null, id, context);
        if (response != null) {
            return response;
        }

        String excerpt =
                prompt.length() > PROMPT_EXCERPT
                        ? prompt.substring(0, PROMPT_EXCERPT) + "..."
                        : prompt;
        return AgentResponse.TextResponse.of(
                "[STUB RESPONSE from " + id + "] " + excerpt,
                Map.of("stub", true, "model", config.getModel()));
    }
}
