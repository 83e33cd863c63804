package io.agency.server.config;

import io.agency.core.execution.RecoveryReport;
import io.agency.core.execution.WorkflowManager;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/// Recovers unfinished workflows from the snapshot store on startup.
///
/// ### Execution Order
/// Runs during the Quarkus startup event, after CDI beans are initialized and
/// before the HTTP listener accepts requests that could race with recovery.
///
/// @see WorkflowManager#recover()
@ApplicationScoped
public class ServerBootstrap {

    private static final Logger LOG = Logger.getLogger(ServerBootstrap.class);

    private final WorkflowManager workflowManager;

    @Inject
    public ServerBootstrap(WorkflowManager workflowManager) {
        this.workflowManager = workflowManager;
    }

    /// Registers persisted workflows with the manager on application startup.
    ///
    /// @param ev the startup event
    void onStart(@Observes StartupEvent ev) {
        LOG.info("Recovering workflows from snapshot store...");

        RecoveryReport report = workflowManager.recover();
        if (report.total() == 0) {
            LOG.info("No unfinished workflows found");
            return;
        }

        LOG.infov(
                "Recovered {0} workflow(s): suspended={1}, resumed={2}, abandoned={3}",
                report.total(),
                report.suspended(),
                report.resumed(),
                report.abandoned());
        if (!report.abandoned().isEmpty()) {
            LOG.warnv(
                    "Workflows left interrupted and not resumed: {0}", report.abandoned());
        }
    }
}
