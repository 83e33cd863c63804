package io.agency.server.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.JsonParseException;
import jakarta.ws.rs.NotAllowedException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> body(Response response) {
        return (Map<String, Object>) response.getEntity();
    }

    @Test
    void shouldHideInternalDetails() {
        Response response = mapper.toResponse(new IllegalStateException("secret at line 42"));

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response)).containsEntry("error", "Internal server error");
    }

    @Test
    void shouldKeepStatusOfWebApplicationException() {
        Response response = mapper.toResponse(new NotFoundException("no route /x"));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(body(response)).containsEntry("error", "Resource not found");
    }

    @Test
    void shouldReportMethodNotAllowed() {
        Response response = mapper.toResponse(new NotAllowedException("GET"));

        assertThat(response.getStatus()).isEqualTo(405);
    }

    @Test
    void shouldMapMalformedJsonTo400() {
        var cause = new JsonParseException(null, "Unexpected character ('}')");

        Response response = mapper.toResponse(new RuntimeException("read failed", cause));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat((String) body(response).get("error"))
                .startsWith("Malformed request body")
                .contains("Unexpected character");
    }
}
