package com.libragraph.mailbackup;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class BackupResourceTest {

    @Test
    void unknownSnapshot_returns404() {
        given()
                .when().get("/api/snapshots/987654321")
                .then()
                .statusCode(404)
                .body("error", containsString("987654321"));
    }

    @Test
    void unknownItem_returns404() {
        given()
                .when().get("/api/items/nobody/inbox/message/ghost")
                .then()
                .statusCode(404);
    }

    @Test
    void unknownBlob_returns404() {
        given()
                .when().get("/api/blobs/" + "ab".repeat(32))
                .then()
                .statusCode(404);
    }

    @Test
    void malformedDigest_returns400() {
        given()
                .when().get("/api/blobs/not-a-digest")
                .then()
                .statusCode(400)
                .body("error", containsString("64 characters"));
    }

    @Test
    void unknownItemKind_returns400() {
        given()
                .when().get("/api/items/contoso/inbox/calendar/x")
                .then()
                .statusCode(400);
    }

    @Test
    void malformedScope_returns400() {
        given()
                .queryParam("scope", "everyone")
                .when().get("/api/snapshots")
                .then()
                .statusCode(400);
    }
}
