package io.agency.server.config;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.agency.core.exception.StorageException;
import io.agency.core.execution.RecoveryReport;
import io.agency.core.execution.WorkflowManager;
import io.quarkus.runtime.StartupEvent;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ServerBootstrapTest {

    private WorkflowManager workflowManager;
    private ServerBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        workflowManager = mock(WorkflowManager.class);
        bootstrap = new ServerBootstrap(workflowManager);
    }

    @Test
    void onStartShouldRecoverWorkflows() {
        when(workflowManager.recover())
                .thenReturn(new RecoveryReport(List.of("a"), List.of("b"), List.of("c")));

        bootstrap.onStart(new StartupEvent());

        verify(workflowManager).recover();
    }

    @Test
    void onStartShouldHandleEmptyStore() {
        when(workflowManager.recover())
                .thenReturn(new RecoveryReport(List.of(), List.of(), List.of()));

        bootstrap.onStart(new StartupEvent());

        verify(workflowManager).recover();
    }

    @Test
    void onStartShouldFailStartupWhenStoreIsUnreadable() {
        when(workflowManager.recover()).thenThrow(new StorageException("cannot list"));

        assertThatThrownBy(() -> bootstrap.onStart(new StartupEvent()))
                .isInstanceOf(StorageException.class);
    }
}
