package io.agency.server.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Last-resort exception mapper that keeps stack traces out of responses.
///
/// Engine errors are handled by the more specific {@link AgencyExceptionMapper};
/// whatever reaches this mapper is either a JAX-RS error (unknown route, bad
/// media type), an unreadable request body or a bug.
///
/// ### Response Format
/// ```json
/// {"error": "Human-readable message", "status": 500}
/// ```
///
/// @implNote Thread-safe. Stateless.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            String message = sanitize(status, wae.getMessage());

            if (status >= 500) {
                LOG.errorv(exception, "Server error: {0}", message);
            } else {
                LOG.debugv("Client error {0}: {1}", status, message);
            }
            return error(status, message);
        }

        JsonProcessingException malformed = findJsonCause(exception);
        if (malformed != null) {
            LOG.debugv("Malformed request body: {0}", malformed.getOriginalMessage());
            return error(400, "Malformed request body: " + malformed.getOriginalMessage());
        }

        LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
        return error(500, "Internal server error");
    }

    private static JsonProcessingException findJsonCause(Throwable exception) {
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof JsonProcessingException jpe) {
                return jpe;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    static Response error(int status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "status", status))
                .build();
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> raw != null ? raw : "Bad request";
            case 404 -> "Resource not found";
            case 405 -> "Method not allowed";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) {
                    yield "Internal server error";
                }
                yield raw != null ? raw : "Request failed";
            }
        };
    }
}
