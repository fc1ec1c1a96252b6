package com.opsdiag.api;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;

@QuarkusTest
class TriggerResourceTest {

    @Test
    void deploymentOfADependencyIsDiagnosedEndToEnd() {
        Instant now = Instant.now();
        given()
                .contentType(ContentType.JSON)
                .body("""
                        [
                          {"id": "e2e-payment-deploy", "service": "paymentservice", "kind": "deployment",
                           "timestamp": "%s", "severity": "info",
                           "attributes": {"commit": "d00d42", "repository": "git@example.com:shop/payment.git"}},
                          {"id": "e2e-checkout-500", "service": "checkoutservice", "kind": "log",
                           "timestamp": "%s", "severity": "error",
                           "attributes": {"message": "charge failed with HTTP 500"}}
                        ]
                        """.formatted(now.minus(Duration.ofMinutes(4)), now.minus(Duration.ofMinutes(2))))
                .when().post("/v1/signals")
                .then()
                .statusCode(200)
                .body("accepted", equalTo(2));

        String incidentId = given()
                .contentType(ContentType.JSON)
                .body("""
                        {"service": "checkoutservice", "severity": "critical",
                         "metricName": "http_5xx_ratio", "value": 0.31, "alarmId": "e2e-1"}
                        """)
                .when().post("/v1/triggers")
                .then()
                .statusCode(200)
                .body("service", equalTo("checkoutservice"))
                .body("criticality", equalTo("CRITICAL"))
                .body("diagnosisStatus", equalTo("COMPLETE"))
                .body("rankedCauses[0].ruleId", equalTo("deployment-regression"))
                .body("rankedCauses[0].explanation", containsString("d00d42"))
                .body("candidateSignalCount", greaterThanOrEqualTo(2))
                .extract().path("incidentId");

        given()
                .when().get("/v1/incidents/{id}/report", incidentId)
                .then()
                .statusCode(200)
                .body("incidentId", equalTo(incidentId))
                .body("statusMessage", containsString("deployment regression"));
    }

    @Test
    void triggerWithoutServiceIsRejected() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"severity\": \"critical\"}")
                .when().post("/v1/triggers")
                .then()
                .statusCode(400)
                .body("message", containsString("service"))
                .body("requestId", notNullValue());
    }

    @Test
    void triggerWithMalformedTimestampIsRejected() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"service\": \"redis\", \"timestamp\": \"yesterday\"}")
                .when().post("/v1/triggers")
                .then()
                .statusCode(400)
                .body("message", containsString("timestamp"));
    }
}
