package io.agency.server.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.agency.core.AgencyConfig;
import io.agency.core.exception.StorageException;
import io.agency.core.execution.WorkflowManager;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SnapshotRetentionJobTest {

    private WorkflowManager workflowManager;
    private SnapshotRetentionJob job;

    @BeforeEach
    void setUp() {
        workflowManager = mock(WorkflowManager.class);
        AgencyConfig config = AgencyConfig.builder().snapshotRetention(Duration.ofDays(2)).build();
        job = new SnapshotRetentionJob(workflowManager, config);
    }

    @Test
    void shouldPurgeWithRetentionCutoff() {
        when(workflowManager.purgeTerminalOlderThan(any())).thenReturn(3);
        Instant before = Instant.now().minus(Duration.ofDays(2));

        job.tick();

        var cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(workflowManager).purgeTerminalOlderThan(cutoff.capture());
        assertThat(cutoff.getValue())
                .isAfterOrEqualTo(before)
                .isBefore(Instant.now().minus(Duration.ofDays(2)).plusSeconds(1));
    }

    @Test
    void shouldSurviveStorageFailure() {
        when(workflowManager.purgeTerminalOlderThan(any()))
                .thenThrow(new StorageException("disk offline"));

        assertThatCode(job::tick).doesNotThrowAnyException();
    }
}
