package io.agency.core;

import io.agency.core.agent.AgentRegistry;
import io.agency.core.execution.WorkflowManager;
import io.agency.core.memory.MemoryStore;
import io.agency.core.state.SnapshotStore;
import io.agency.core.tool.ToolRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Container holding the wired engine components of one daemon process.
///
/// Replaces ambient global state: the set of live workflows lives in the
/// {@link WorkflowManager} owned here, built at startup and torn down by
/// {@link #close()}.
///
/// ### Contracts
/// - **Postcondition**: getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @implNote Safe for concurrent reads. The contained components carry their
/// own thread-safety guarantees.
///
/// @apiNote Create instances via {@link AgencyFactory#createEnvironment()} or
/// {@link AgencyFactory.Builder} rather than direct construction.
///
/// @see AgencyFactory
public final class AgencyEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(AgencyEnvironment.class.getName());

    private final AgencyConfig config;
    private final WorkflowManager workflowManager;
    private final AgentRegistry agentRegistry;
    private final ToolRegistry toolRegistry;
    private final MemoryStore memoryStore;
    private final SnapshotStore snapshotStore;
    private final ExecutorService executorService;

    public AgencyEnvironment(
            AgencyConfig config,
            WorkflowManager workflowManager,
            AgentRegistry agentRegistry,
            ToolRegistry toolRegistry,
            MemoryStore memoryStore,
            SnapshotStore snapshotStore,
            ExecutorService executorService) {
        this.config = config;
        this.workflowManager = workflowManager;
        this.agentRegistry = agentRegistry;
        this.toolRegistry = toolRegistry;
        this.memoryStore = memoryStore;
        this.snapshotStore = snapshotStore;
        this.executorService = executorService;
    }

    public AgencyConfig getConfig() {
        return config;
    }

    /// Returns the manager through which workflows are created, run and inspected.
    ///
    /// @return the workflow manager, never null
    public WorkflowManager getWorkflowManager() {
        return workflowManager;
    }

    public AgentRegistry getAgentRegistry() {
        return agentRegistry;
    }

    /// Returns the tools available to the reasoning loop and to raw tool steps.
    ///
    /// @return the tool registry, never null
    public ToolRegistry getToolRegistry() {
        return toolRegistry;
    }

    public MemoryStore getMemoryStore() {
        return memoryStore;
    }

    public SnapshotStore getSnapshotStore() {
        return snapshotStore;
    }

    /// Drains running workflows and stops the thread pool.
    ///
    /// @apiNote **Side effects**:
    /// - Running workflows are asked to suspend at their next step boundary
    ///   when suspend/resume is enabled
    /// - Blocks up to the configured shutdown timeout
    /// - No new background runs are accepted afterwards
    ///
    /// @implNote Workflows still running after the timeout keep their last
    /// committed snapshot and are recovered on the next startup.
    @Override
    public void close() {
        boolean drained = workflowManager.shutdown(config.getShutdownTimeout());
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(1, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Agency environment closed" + (drained ? "" : " with workflows still running"));
    }
}
