package io.agency.server.integration;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import io.restassured.http.ContentType;
import io.restassured.path.json.JsonPath;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@QuarkusTest
@TestProfile(InMemoryTestProfile.class)
class WorkflowLifecycleIntegrationTest extends IntegrationTestBase {

    private static String singleStep(String id) {
        return "{\"workflow_id\": \""
                + id
                + "\", \"initial_message\": \"Capital of France?\", \"max_steps\": 3}";
    }

    @Nested
    class SingleStep {

        @Test
        void shouldRunToCompletionInBackground() {
            String id = uniqueId("capital");

            JsonPath ack = createWorkflow(singleStep(id));
            assertThat(ack.getString("workflow_id")).isEqualTo(id);
            assertThat(ack.getString("status")).isIn("PENDING", "RUNNING", "COMPLETED");

            JsonPath view = awaitStatus(id, "COMPLETED");
            assertThat(view.getString("output")).isEqualTo(CANNED_ANSWER);
            assertThat(view.getList("steps.status")).containsExactly("SUCCEEDED");
            assertThat(view.getInt("steps[0].attempts")).isEqualTo(1);
        }

        @Test
        void shouldExposeEverySnapshotVersion() {
            String id = uniqueId("history");
            createWorkflow(singleStep(id));
            JsonPath view = awaitStatus(id, "COMPLETED");
            int latest = view.getInt("version");

            List<Integer> versions =
                    given().when()
                            .get("/api/v1/workflows/snapshots")
                            .then()
                            .statusCode(200)
                            .extract()
                            .jsonPath()
                            .getList("findAll { it.workflow_id == '" + id + "' }.version", Integer.class);
            assertThat(versions).isNotEmpty().isSorted().endsWith(latest);
            assertThat(versions.get(0)).isEqualTo(1);

            given().when()
                    .get("/api/v1/workflows/snapshots/" + id)
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("COMPLETED"));
            given().queryParam("version", 1)
                    .when()
                    .get("/api/v1/workflows/snapshots/" + id)
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("PENDING"));
        }

        @Test
        void shouldDeleteFinishedWorkflow() {
            String id = uniqueId("cleanup");
            createWorkflow(singleStep(id));
            int versions = awaitStatus(id, "COMPLETED").getInt("version");

            given().when()
                    .delete("/api/v1/workflows/snapshots/" + id)
                    .then()
                    .statusCode(200)
                    .body("deleted", equalTo(versions));
            given().when().get("/api/v1/workflows/" + id).then().statusCode(404);
        }

        @Test
        void shouldRejectDuplicateId() {
            String id = uniqueId("twice");
            createWorkflow(singleStep(id));

            given().contentType(ContentType.JSON)
                    .body(singleStep(id))
                    .when()
                    .post("/api/v1/workflows")
                    .then()
                    .statusCode(400)
                    .body("error", containsString("already exists"));
        }
    }

    @Nested
    class Saga {

        @Test
        void shouldCompensateCompletedStepsWhenLaterStepFails() {
            String id = uniqueId("saga");
            String body =
                    """
                    {"workflow_id": "%s", "max_steps": 2, "steps": [
                      {"name": "probe",
                       "forward": {"type": "tool", "toolName": "system_info", "arguments": {}},
                       "compensation": {"type": "noop"}},
                      {"name": "broken",
                       "forward": {"type": "tool", "toolName": "missing", "arguments": {}}}
                    ]}
                    """
                            .formatted(id);

            createWorkflow(body);
            JsonPath view = awaitStatus(id, "COMPENSATED");

            assertThat(view.getList("steps.name")).containsExactly("probe", "broken");
            assertThat(view.getList("steps.status")).containsExactly("COMPENSATED", "FAILED");
            assertThat(view.getString("steps[1].error")).contains("missing");
        }

        @Test
        void shouldRejectUnknownActionType() {
            given().contentType(ContentType.JSON)
                    .body(
                            "{\"workflow_id\": \"bad-type\", \"steps\": ["
                                    + "{\"name\": \"x\", \"forward\": {\"type\": \"shell\"}}]}")
                    .when()
                    .post("/api/v1/workflows")
                    .then()
                    .statusCode(400);
        }
    }

    @Nested
    class Conflicts {

        @Test
        void shouldRefuseToSuspendFinishedWorkflow() {
            String id = uniqueId("finished");
            createWorkflow(singleStep(id));
            awaitStatus(id, "COMPLETED");

            given().contentType(ContentType.JSON)
                    .body("{\"reason\": \"maintenance\"}")
                    .when()
                    .post("/api/v1/workflows/" + id + "/suspend")
                    .then()
                    .statusCode(409)
                    .body("error", containsString("COMPLETED"));
        }

        @Test
        void shouldAcknowledgeResumeOfFinishedWorkflow() {
            String id = uniqueId("again");
            createWorkflow(singleStep(id));
            awaitStatus(id, "COMPLETED");

            given().when()
                    .post("/api/v1/workflows/" + id + "/resume")
                    .then()
                    .statusCode(202)
                    .body("status", equalTo("COMPLETED"));
        }

        @Test
        void shouldReturn404ForUnknownWorkflow() {
            given().when().get("/api/v1/workflows/never-created").then().statusCode(404);
            given().when()
                    .post("/api/v1/workflows/never-created/resume")
                    .then()
                    .statusCode(404);
            given().when()
                    .delete("/api/v1/workflows/snapshots/never-created")
                    .then()
                    .statusCode(404);
        }
    }
}
