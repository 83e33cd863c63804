package io.agency.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agency.core.exception.StorageException;
import io.agency.core.exception.TransientToolException;
import io.agency.core.exception.UnrecoverableException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultToolInvokerTest {

    private DefaultToolRegistry registry;
    private DefaultToolInvoker invoker;
    private RecordingTool tool;

    @BeforeEach
    void setUp() {
        tool = new RecordingTool();
        registry = new DefaultToolRegistry(List.of(tool, new SystemInfoTool()));
        invoker = new DefaultToolInvoker(registry);
    }

    @Test
    void shouldInvokeRegisteredTool() {
        assertThat(invoker.invoke(RecordingTool.NAME, RecordingTool.label("a"))).isEqualTo("done:a");
        assertThat(tool.calls()).containsExactly("a");
    }

    @Test
    void shouldRejectUnknownTool() {
        assertThatThrownBy(() -> invoker.invoke("shell", Map.of()))
                .isInstanceOf(UnrecoverableException.class)
                .hasMessage("Unknown tool: shell");
    }

    @Test
    void shouldRejectMissingRequiredArguments() {
        assertThatThrownBy(() -> invoker.invoke(RecordingTool.NAME, Map.of()))
                .isInstanceOf(UnrecoverableException.class)
                .hasMessageContaining("missing required arguments: [label]");
        assertThat(tool.calls()).isEmpty();
    }

    @Test
    void shouldPassTransientFailuresThrough() {
        tool.failTransiently("x", 1);

        assertThatThrownBy(() -> invoker.invoke(RecordingTool.NAME, RecordingTool.label("x")))
                .isInstanceOf(TransientToolException.class);
    }

    @Test
    void shouldWrapUnexpectedHandlerFailures() {
        registry.register(
                new ToolHandler() {
                    @Override
                    public ToolDefinition definition() {
                        return ToolDefinition.simple("broken", "always throws");
                    }

                    @Override
                    public String execute(Map<String, Object> arguments) {
                        throw new IllegalStateException("boom");
                    }
                });

        assertThatThrownBy(() -> invoker.invoke("broken", null))
                .isInstanceOf(UnrecoverableException.class)
                .hasMessage("Tool 'broken' failed: boom")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldTreatOtherEngineExceptionsAsPermanent() {
        tool.throwOn("ledger", new StorageException("ledger backend down"));

        assertThatThrownBy(() -> invoker.invoke(RecordingTool.NAME, RecordingTool.label("ledger")))
                .isInstanceOf(UnrecoverableException.class)
                .hasMessage("Tool 'record' failed: ledger backend down")
                .hasCauseInstanceOf(StorageException.class);
    }

    @Test
    void shouldReportHostDetailsFromSystemInfo() {
        assertThat(invoker.invoke(SystemInfoTool.NAME, Map.of()))
                .startsWith("os=")
                .contains("java=" + System.getProperty("java.version"));
    }

    @Test
    void shouldListDefinitionsSortedByName() {
        assertThat(registry.definitions())
                .extracting(ToolDefinition::name)
                .containsExactly(RecordingTool.NAME, SystemInfoTool.NAME);
    }
}
