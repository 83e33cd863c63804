package io.agency.core.agent.stub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agency.core.agent.AgentConfig;
import io.agency.core.agent.AgentResponse;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StubResponseRegistryTest {

    private StubResponseRegistry registry;

    @BeforeEach
    void setUp() {
        registry = StubResponseRegistry.getInstance();
        registry.clearResponses();
    }

    @AfterEach
    void tearDown() {
        registry.clearResponses();
    }

    private static String text(AgentResponse response) {
        assertThat(response).isInstanceOf(AgentResponse.TextResponse.class);
        return ((AgentResponse.TextResponse) response).content();
    }

    @Nested
    class Registered {

        @Test
        void shouldPreferStepNameOverAgentId() {
            // GIVEN
            registry.registerResponse("assistant", "by agent");
            registry.registerResponse("respond", "by step");

            // WHEN
            var response = registry.nextResponse("respond", "assistant", Map.of());

            // THEN
            assertThat(text(response)).isEqualTo("by step");
        }

        @Test
        void shouldPlaySequenceAndRepeatLastResponse() {
            registry.registerResponses(
                    "think",
                    List.of(
                            AgentResponse.ToolRequest.of("system_info", Map.of()),
                            AgentResponse.TextResponse.of("final")));

            var first = registry.nextResponse("think", null, Map.of());
            var second = registry.nextResponse("think", null, Map.of());
            var third = registry.nextResponse("think", null, Map.of());

            assertThat(first).isInstanceOf(AgentResponse.ToolRequest.class);
            assertThat(text(second)).isEqualTo("final");
            assertThat(text(third)).isEqualTo("final");
        }

        @Test
        void shouldFallBackToDefaultScenario() {
            registry.registerResponse("answer", "default answer");

            var response = registry.nextResponse("answer", null, Map.of("stub_scenario", "other"));

            assertThat(text(response)).isEqualTo("default answer");
        }

        @Test
        void shouldUseScenarioSpecificResponse() {
            registry.registerResponse("answer", "default answer");
            registry.registerResponse("failure", "answer", "scenario answer");

            var response =
                    registry.nextResponse("answer", null, Map.of("stub_scenario", "failure"));

            assertThat(text(response)).isEqualTo("scenario answer");
        }

        @Test
        void shouldRejectEmptySequence() {
            assertThatThrownBy(() -> registry.registerResponses("x", List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldReturnNullWhenNothingConfigured() {
            assertThat(registry.nextResponse("unknown-step", "unknown-agent", Map.of())).isNull();
        }
    }

    @Nested
    class Resources {

        @Test
        void shouldLoadClasspathResponseAndSubstitutePlaceholders() {
            var response = registry.nextResponse("greeting", null, Map.of("user", "Ada"));

            assertThat(text(response)).isEqualTo("Hello Ada, this is a canned answer.");
        }

        @Test
        void shouldKeepUnknownPlaceholders() {
            var response = registry.nextResponse("greeting", null, Map.of());

            assertThat(text(response)).contains("{{user}}");
        }

        @Test
        void shouldLoadScenarioResource() {
            var response =
                    registry.nextResponse("greeting", null, Map.of("stub_scenario", "review"));

            assertThat(text(response)).isEqualTo("Review scenario answer");
        }
    }

    @Nested
    class StubAgentAnswers {

        @Test
        void shouldAnswerFromRegistryByStepName() {
            registry.registerResponse("respond", "scripted");
            var agent =
                    new StubAgent(
                            "assistant", AgentConfig.builder().id("assistant").model("stub").build());

            var response = agent.execute("prompt", Map.of("step", "respond"));

            assertThat(text(response)).isEqualTo("scripted");
        }

        @Test
        void shouldEchoPromptWhenNothingRegistered() {
            var agent =
                    new StubAgent(
                            "assistant", AgentConfig.builder().id("assistant").model("stub").build());

            var response = agent.execute("What is up?", Map.of());

            assertThat(text(response)).isEqualTo("[STUB RESPONSE from assistant] What is up?");
        }
    }
}
