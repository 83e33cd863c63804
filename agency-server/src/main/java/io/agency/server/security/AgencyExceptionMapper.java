package io.agency.server.security;

import io.agency.core.exception.AgencyException;
import io.agency.core.exception.CompensationFailedException;
import io.agency.core.exception.ConfigurationException;
import io.agency.core.exception.StorageException;
import io.agency.core.exception.TransientException;
import io.agency.core.exception.UnrecoverableException;
import io.agency.core.exception.WorkflowConflictException;
import io.agency.core.exception.WorkflowNotFoundException;
import io.agency.server.validation.LogSanitizer;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

/// Maps the engine's error taxonomy to HTTP status codes.
///
/// | Exception | Status |
/// |-----------|--------|
/// | {@link WorkflowNotFoundException} | 404 |
/// | {@link ConfigurationException} | 400 |
/// | {@link WorkflowConflictException}, {@link CompensationFailedException} | 409 |
/// | {@link UnrecoverableException} | 502 |
/// | {@link StorageException}, {@link TransientException} | 503 |
/// | any other {@link AgencyException} | 500 |
///
/// Messages are returned verbatim: engine messages name workflows and steps
/// but never carry stack traces or credentials. A compensation failure also
/// reports which step needs manual remediation.
///
/// @implNote Thread-safe. Stateless.
/// @see GlobalExceptionMapper
@Provider
public class AgencyExceptionMapper implements ExceptionMapper<AgencyException> {

    private static final Logger LOG = Logger.getLogger(AgencyExceptionMapper.class);

    @Override
    public Response toResponse(AgencyException exception) {
        int status = statusOf(exception);
        String message = exception.getMessage() != null ? exception.getMessage() : "Request failed";

        if (status >= 500) {
            LOG.errorv(exception, "Engine error {0}: {1}", status, LogSanitizer.sanitize(message));
        } else {
            LOG.debugv("Engine rejected request {0}: {1}", status, LogSanitizer.sanitize(message));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("status", status);
        if (exception instanceof CompensationFailedException cfe) {
            body.put("workflow_id", cfe.getWorkflowId());
            body.put("step_index", cfe.getStepIndex());
            body.put("step_name", cfe.getStepName());
        }
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }

    static int statusOf(AgencyException exception) {
        if (exception instanceof WorkflowNotFoundException) {
            return 404;
        }
        if (exception instanceof ConfigurationException) {
            return 400;
        }
        if (exception instanceof WorkflowConflictException
                || exception instanceof CompensationFailedException) {
            return 409;
        }
        if (exception instanceof UnrecoverableException) {
            return 502;
        }
        if (exception instanceof StorageException || exception instanceof TransientException) {
            return 503;
        }
        return 500;
    }
}
