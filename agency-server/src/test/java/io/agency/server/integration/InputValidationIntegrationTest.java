package io.agency.server.integration;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

/// Bean Validation and body parsing through the full JAX-RS pipeline.
@QuarkusTest
@TestProfile(InMemoryTestProfile.class)
class InputValidationIntegrationTest extends IntegrationTestBase {

    @Test
    void shouldRejectUnsafePathId() {
        given().when()
                .get("/api/v1/workflows/bad id!")
                .then()
                .statusCode(400)
                .body("status", equalTo(400))
                .body("error", containsString("letter or digit"));
    }

    @Test
    void shouldRejectMissingWorkflowId() {
        given().contentType(ContentType.JSON)
                .body("{\"initial_message\": \"hi\"}")
                .when()
                .post("/api/v1/workflows")
                .then()
                .statusCode(400)
                .body("error", containsString("workflowId"));
    }

    @Test
    void shouldRejectTraversalInBodyId() {
        given().contentType(ContentType.JSON)
                .body("{\"workflow_id\": \"../etc\", \"initial_message\": \"hi\"}")
                .when()
                .post("/api/v1/workflows")
                .then()
                .statusCode(400);
    }

    @Test
    void shouldRejectMissingMessageWithoutSteps() {
        given().contentType(ContentType.JSON)
                .body("{\"workflow_id\": \"no-message\"}")
                .when()
                .post("/api/v1/workflows")
                .then()
                .statusCode(400)
                .body("error", containsString("initial_message"));
    }

    @Test
    void shouldRejectMalformedJson() {
        given().contentType(ContentType.JSON)
                .body("{\"workflow_id\": ")
                .when()
                .post("/api/v1/workflows")
                .then()
                .statusCode(400);
    }

    @Test
    void shouldRejectMissingBody() {
        given().contentType(ContentType.JSON)
                .when()
                .post("/api/v1/agent/process")
                .then()
                .statusCode(400);
    }
}
