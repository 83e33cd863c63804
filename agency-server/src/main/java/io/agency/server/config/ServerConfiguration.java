package io.agency.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agency.core.AgencyConfig;
import io.agency.core.AgencyEnvironment;
import io.agency.core.agent.AgentRegistry;
import io.agency.core.execution.WorkflowManager;
import io.agency.core.state.SnapshotStore;
import io.agency.core.tool.ToolRegistry;
import io.agency.serialization.SnapshotSerializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI configuration for server-specific beans.
///
/// Engine components are built by {@link AgencyEnvironmentProducer}. This class
/// produces:
/// - The shared {@link ObjectMapper}, which also serves REST payloads, so step
///   actions use the same `type`-discriminated JSON on the wire and on disk
/// - Delegating producers that expose {@link AgencyEnvironment} components for
///   direct injection
@ApplicationScoped
public class ServerConfiguration {

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return SnapshotSerializer.createMapper();
    }

    // ========== AgencyEnvironment Component Delegates ==========

    /// Produces the workflow manager from the agency environment for CDI injection.
    ///
    /// @param env the initialized environment, not null
    /// @return the workflow manager, never null
    @Produces
    @Singleton
    public WorkflowManager workflowManager(AgencyEnvironment env) {
        return env.getWorkflowManager();
    }

    @Produces
    @Singleton
    public SnapshotStore snapshotStore(AgencyEnvironment env) {
        return env.getSnapshotStore();
    }

    @Produces
    @Singleton
    public AgentRegistry agentRegistry(AgencyEnvironment env) {
        return env.getAgentRegistry();
    }

    @Produces
    @Singleton
    public ToolRegistry toolRegistry(AgencyEnvironment env) {
        return env.getToolRegistry();
    }

    @Produces
    @Singleton
    public AgencyConfig agencyConfig(AgencyEnvironment env) {
        return env.getConfig();
    }
}
