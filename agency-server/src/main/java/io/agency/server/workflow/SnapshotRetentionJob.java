package io.agency.server.workflow;

import io.agency.core.AgencyConfig;
import io.agency.core.execution.WorkflowManager;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import org.jboss.logging.Logger;

/// Scheduled job that removes snapshots of long-finished workflows.
///
/// On each tick, deletes every workflow whose latest snapshot is terminal
/// (`COMPLETED`, `COMPENSATED`, `FAILED`) and older than the configured
/// retention. Suspended and interrupted workflows are never touched.
///
/// ### Configuration
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `agency.snapshot.retention-interval` | `1h` | How often the purge runs |
/// | `agency.snapshot.retention` | `7d` | Age after which terminal workflows are removed |
///
/// @implNote A failed tick is logged and retried on the next interval.
///
/// @see WorkflowManager#purgeTerminalOlderThan(Instant)
@ApplicationScoped
public class SnapshotRetentionJob {

    private static final Logger LOG = Logger.getLogger(SnapshotRetentionJob.class);

    private final WorkflowManager workflowManager;
    private final AgencyConfig config;

    @Inject
    public SnapshotRetentionJob(WorkflowManager workflowManager, AgencyConfig config) {
        this.workflowManager = workflowManager;
        this.config = config;
    }

    @Scheduled(
            every = "${agency.snapshot.retention-interval:1h}",
            delayed = "${agency.snapshot.retention-interval:1h}")
    void tick() {
        Instant cutoff = Instant.now().minus(config.getSnapshotRetention());
        try {
            int removed = workflowManager.purgeTerminalOlderThan(cutoff);
            if (removed > 0) {
                LOG.infov("Retention removed {0} terminal workflow(s) older than {1}", removed, cutoff);
            }
        } catch (RuntimeException e) {
            LOG.errorv(e, "Snapshot retention failed for cutoff {0}", cutoff);
        }
    }
}
