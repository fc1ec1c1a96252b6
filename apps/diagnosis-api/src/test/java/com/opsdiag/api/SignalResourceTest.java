package com.opsdiag.api;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

@QuarkusTest
class SignalResourceTest {

    @Test
    void singleSignalIsStoredAndQueryable() {
        Instant at = Instant.now().minusSeconds(30);
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"id": "sig-single", "service": "signal-test-a", "kind": "METRIC",
                         "timestamp": "%s", "severity": "warning",
                         "attributes": {"metricName": "cpu_utilization"}, "numericValue": 0.91}
                        """.formatted(at))
                .when().post("/v1/signals")
                .then()
                .statusCode(200)
                .body("accepted", equalTo(1));

        given()
                .queryParam("service", "signal-test-a")
                .queryParam("kinds", "metric")
                .when().get("/v1/signals")
                .then()
                .statusCode(200)
                .body("$", hasSize(1))
                .body("[0].id", equalTo("sig-single"))
                .body("[0].numericValue", equalTo(0.91f));
    }

    @Test
    void batchReportsInvalidEntriesAndKeepsTheRest() {
        Instant now = Instant.now();
        given()
                .contentType(ContentType.JSON)
                .body("""
                        [
                          {"id": "batch-ok", "service": "signal-test-b", "kind": "log",
                           "timestamp": "%s", "severity": "error", "attributes": {"message": "boom"}},
                          {"id": "batch-bad-kind", "service": "signal-test-b", "kind": "smell",
                           "timestamp": "%s", "severity": "error"},
                          {"id": "batch-future", "service": "signal-test-b", "kind": "log",
                           "timestamp": "%s", "severity": "error"}
                        ]
                        """.formatted(now.minusSeconds(10), now.minusSeconds(5), now.plus(Duration.ofHours(1))))
                .when().post("/v1/signals")
                .then()
                .statusCode(200)
                .body("accepted", equalTo(1))
                .body("rejected", hasSize(2))
                .body("rejected[0].id", equalTo("batch-bad-kind"))
                .body("rejected[1].reason", containsString("clock-skew"));
    }

    @Test
    void invalidSingleSignalIsABadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"id": "no-service", "kind": "log", "timestamp": "2024-01-01T00:00:00Z"}
                        """)
                .when().post("/v1/signals")
                .then()
                .statusCode(400)
                .body("message", containsString("service"));
    }

    @Test
    void queryRequiresAService() {
        given()
                .when().get("/v1/signals")
                .then()
                .statusCode(400);
    }
}
