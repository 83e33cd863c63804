package io.agency.server.integration;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;

import io.agency.core.agent.stub.StubResponseRegistry;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import io.restassured.http.ContentType;
import io.restassured.path.json.JsonPath;
import org.junit.jupiter.api.Test;

@QuarkusTest
@TestProfile(InMemoryTestProfile.class)
class AgentProcessIntegrationTest extends IntegrationTestBase {

    @Test
    void healthShouldReportOk() {
        given().when()
                .get("/health")
                .then()
                .statusCode(200)
                .body("status", equalTo("ok"))
                .body("version", notNullValue());
    }

    @Test
    void processShouldAnswerFromStubResource() {
        JsonPath result =
                given().contentType(ContentType.JSON)
                        .body("{\"message\": \"What is the capital of France?\", \"max_steps\": 3}")
                        .when()
                        .post("/api/v1/agent/process")
                        .then()
                        .statusCode(200)
                        .extract()
                        .jsonPath();

        assertThat(result.getString("response")).isEqualTo(CANNED_ANSWER);
        assertThat(result.getInt("steps_executed")).isEqualTo(1);
        assertThat(result.getBoolean("completed")).isTrue();
    }

    @Test
    void processShouldUseRegisteredResponse() {
        StubResponseRegistry.getInstance().registerResponse("respond", "Registered answer");

        given().contentType(ContentType.JSON)
                .body("{\"message\": \"anything\"}")
                .when()
                .post("/api/v1/agent/process")
                .then()
                .statusCode(200)
                .body("response", equalTo("Registered answer"));
    }

    @Test
    void processShouldRejectBlankMessage() {
        given().contentType(ContentType.JSON)
                .body("{\"message\": \"   \"}")
                .when()
                .post("/api/v1/agent/process")
                .then()
                .statusCode(400)
                .body("status", equalTo(400));
    }

    @Test
    void processShouldRejectZeroSteps() {
        given().contentType(ContentType.JSON)
                .body("{\"message\": \"hi\", \"max_steps\": 0}")
                .when()
                .post("/api/v1/agent/process")
                .then()
                .statusCode(400);
    }
}
