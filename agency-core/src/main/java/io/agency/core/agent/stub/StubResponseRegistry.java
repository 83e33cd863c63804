package io.agency.core.agent.stub;

import io.agency.core.agent.AgentResponse;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// Singleton registry of scripted responses for {@link StubAgent}.
///
/// Responses are keyed by scenario, then by step name or agent id. A key may
/// hold a sequence of responses, which lets a test script a reasoning
/// trajectory: each call consumes the head of the sequence and the last entry
/// repeats once the rest are used up.
///
/// ### Response Resolution Order
/// 1. Registered sequence for the step name (`step` context key)
/// 2. Registered sequence for the agent id
/// 3. Classpath resource `/stubs/{scenario}/{step}.txt`, then `/stubs/{scenario}/{agentId}.txt`
/// 4. The same lookups in the `default` scenario
/// 5. null (the agent generates a fallback answer)
///
/// ### Scenario Selection
/// - Context variable: `context.put("stub_scenario", "flaky")`
/// - System property: `-Dagency.stub.scenario=flaky`
/// - Default: `"default"`
///
/// Text responses support `{{key}}` placeholders filled from the context.
///
/// @implNote Thread-safe singleton. Sequences are guarded by their own monitor.
public class StubResponseRegistry {

    private static final Logger logger = Logger.getLogger(StubResponseRegistry.class.getName());
    private static final String STUB_RESOURCE_BASE = "/stubs/";
    private static final String DEFAULT_SCENARIO = "default";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([a-zA-Z0-9_]+)}}");

    private static final StubResponseRegistry INSTANCE = new StubResponseRegistry();

    private final Map<String, Map<String, Deque<AgentResponse>>> registered =
            new ConcurrentHashMap<>();
    private final Map<String, String> resourceCache = new ConcurrentHashMap<>();

    private StubResponseRegistry() {}

    public static StubResponseRegistry getInstance() {
        return INSTANCE;
    }

    /// Registers a text answer for a scenario.
    ///
    /// @param scenario scenario name, not null
    /// @param key step name or agent id, not null
    /// @param response answer text, may contain `{{key}}` placeholders, not null
    public void registerResponse(String scenario, String key, String response) {
        registerResponses(scenario, key, List.of(AgentResponse.TextResponse.of(response)));
    }

    /// Registers a text answer for the default scenario.
    ///
    /// @param key step name or agent id, not null
    /// @param response answer text, not null
    public void registerResponse(String key, String response) {
        registerResponse(DEFAULT_SCENARIO, key, response);
    }

    /// Registers a scripted response sequence for the default scenario.
    ///
    /// @param key step name or agent id, not null
    /// @param responses responses returned in order, the last one repeating, not empty
    public void registerResponses(String key, List<AgentResponse> responses) {
        registerResponses(DEFAULT_SCENARIO, key, responses);
    }

    /// Registers a scripted response sequence, replacing any existing one.
    ///
    /// @param scenario scenario name, not null
    /// @param key step name or agent id, not null
    /// @param responses responses returned in order, the last one repeating, not empty
    /// @throws IllegalArgumentException if `responses` is empty
    public void registerResponses(String scenario, String key, List<AgentResponse> responses) {
        if (responses.isEmpty()) {
            throw new IllegalArgumentException("responses must not be empty");
        }
        registered
                .computeIfAbsent(scenario, s -> new ConcurrentHashMap<>())
                .put(key, new ArrayDeque<>(responses));
        logger.fine("Registered " + responses.size() + " stub responses for " + scenario + "/" + key);
    }

    /// Clears all registered responses and cached resources.
    public void clearResponses() {
        registered.clear();
        resourceCache.clear();
    }

    /// Resolves the next response for a call.
    ///
    /// @param stepName current step name, may be null
    /// @param agentId calling agent id, may be null
    /// @param context step context for scenario and placeholders, may be null
    /// @return the response, or null if nothing is configured
    public AgentResponse nextResponse(String stepName, String agentId, Map<String, Object> context) {
        String scenario = getScenario(context);

        AgentResponse response = lookup(scenario, stepName, agentId, context);
        if (response == null && !DEFAULT_SCENARIO.equals(scenario)) {
            response = lookup(DEFAULT_SCENARIO, stepName, agentId, context);
        }
        return response;
    }

    private AgentResponse lookup(
            String scenario, String stepName, String agentId, Map<String, Object> context) {
        for (String key : new String[] {stepName, agentId}) {
            if (key == null) {
                continue;
            }
            AgentResponse response = takeRegistered(scenario, key);
            if (response != null) {
                logger.info("[STUB] Using registered response for " + scenario + "/" + key);
                return substitute(response, context);
            }
        }
        for (String key : new String[] {stepName, agentId}) {
            if (key == null) {
                continue;
            }
            String content = loadResourceResponse(scenario, key);
            if (content != null) {
                logger.info("[STUB] Loaded resource response for " + scenario + "/" + key);
                return substitute(AgentResponse.TextResponse.of(content), context);
            }
        }
        return null;
    }

    private AgentResponse takeRegistered(String scenario, String key) {
        Map<String, Deque<AgentResponse>> scenarioResponses = registered.get(scenario);
        if (scenarioResponses == null) {
            return null;
        }
        Deque<AgentResponse> sequence = scenarioResponses.get(key);
        if (sequence == null) {
            return null;
        }
        synchronized (sequence) {
            return sequence.size() > 1 ? sequence.pollFirst() : sequence.peekFirst();
        }
    }

    private String getScenario(Map<String, Object> context) {
        if (context != null) {
            Object scenario = context.get("stub_scenario");
            if (scenario != null) {
                return scenario.toString();
            }
        }

        String sysProp = System.getProperty("agency.stub.scenario");
        if (sysProp != null && !sysProp.isBlank()) {
            return sysProp;
        }

        return DEFAULT_SCENARIO;
    }

    private String loadResourceResponse(String scenario, String key) {
        String cached =
                resourceCache.computeIfAbsent(
                        scenario + "/" + key,
                        k -> {
                            String content = loadResource(STUB_RESOURCE_BASE + k + ".txt");
                            return content != null ? content : "";
                        });
        return cached.isEmpty() ? null : cached;
    }

    private String loadResource(String path) {
        try (InputStream is = getClass().getResourceAsStream(path)) {
            if (is == null) {
                return null;
            }
            try (BufferedReader reader =
                    new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        } catch (IOException e) {
            logger.warning("Failed to load stub resource: " + path + " - " + e.getMessage());
            return null;
        }
    }

    private AgentResponse substitute(AgentResponse response, Map<String, Object> context) {
        if (!(response instanceof AgentResponse.TextResponse text) || context == null) {
            return response;
        }
        Matcher matcher = PLACEHOLDER.matcher(text.content());
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = context.get(matcher.group(1));
            String replacement = value != null ? value.toString() : matcher.group(0);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return AgentResponse.TextResponse.of(result.toString(), text.metadata());
    }
}
