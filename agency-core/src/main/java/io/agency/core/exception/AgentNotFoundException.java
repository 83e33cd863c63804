package io.agency.core.exception;

import java.io.Serial;

/// No agent is registered under the requested id.
///
/// Treated as a permanent failure of the step that asked for it.
public class AgentNotFoundException extends AgencyException {

    @Serial private static final long serialVersionUID = -3170082264159542917L;

    public AgentNotFoundException(String agentId) {
        super("Agent not found: " + agentId);
    }
}
