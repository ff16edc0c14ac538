package io.github.loregraph.semantic;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

/**
 * REST tests for reviewing semantic relations over the fixture vault.
 *
 * Nothing here writes to the fixture vault: applied rows only target missing notes or are invalid.
 */
@QuarkusTest
class SemanticRelationResourcesTest {

    private static final String BASE = "/semantic-relations";
    private static final String TOOL_PAYLOAD = "{\"semanticRelationProposals\":[{\"notePath\":\"Characters/Lira\","
        + "\"predicate\":\"enemy of\",\"targetPath\":\"[[Places/Valoria]]\",\"confidence\":0.9}]}";

    @BeforeEach
    void clearProposals() {
        given().when().delete(BASE + "/proposals").then().statusCode(204);
    }

    @Test
    @DisplayName("GET /batches should list relations declared in the vault")
    void testVaultBatches() {
        given()
            .queryParam("includeToolProposals", false)
        .when()
            .get(BASE + "/batches")
        .then()
            .statusCode(200)
            .body("$", hasSize(1))
            .body("[0].id", equalTo("semantic-batch-1"))
            .body("[0].rows", hasSize(2))
            .body("[0].rows.predicate", hasItem("allied_with"))
            .body("[0].rows.predicate", hasItem("located_in"))
            .body("[0].rows.proposalSource", everyItem(equalTo("vault-frontmatter")));
    }

    @Test
    @DisplayName("ingested tool output should be buffered and included in batches")
    void testIngestProposals() {
        // Act
        given()
            .contentType(ContentType.JSON)
            .body(Map.of("toolName", "extractEntityRelations", "payload", TOOL_PAYLOAD))
        .when()
            .post(BASE + "/proposals")
        .then()
            .statusCode(200)
            .body("accepted", equalTo(1))
            .body("stored", equalTo(1));

        // Assert
        given()
        .when()
            .get(BASE + "/proposals")
        .then()
            .statusCode(200)
            .body("$", hasSize(1))
            .body("[0].predicate", equalTo("rival_of"))
            .body("[0].notePath", equalTo("Characters/Lira.md"))
            .body("[0].sourceField", equalTo("tool:extractEntityRelations"));

        given()
        .when()
            .get(BASE + "/batches")
        .then()
            .statusCode(200)
            .body("[0].totalRows", equalTo(3))
            .body("[0].rows.predicate", hasItem("rival_of"));
    }

    @Test
    @DisplayName("structured tool payloads should be accepted as JSON")
    void testIngestStructuredPayload() {
        Map<String, Object> body = Map.of(
            "toolName", "submitSemanticRelationProposals",
            "payload", Map.of("proposals", List.of(Map.of(
                "notePath", "Characters/Arin",
                "predicate", "ally",
                "targetPath", "Characters/Lira"))));

        given()
            .contentType(ContentType.JSON)
            .body(body)
        .when()
            .post(BASE + "/proposals")
        .then()
            .statusCode(200)
            .body("accepted", equalTo(1));
    }

    @Test
    @DisplayName("POST /proposals without a tool name should fail validation")
    void testIngestWithoutToolName() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"toolName\": \"\", \"payload\": \"[]\"}")
        .when()
            .post(BASE + "/proposals")
        .then()
            .statusCode(400);
    }

    @Test
    @DisplayName("DELETE /proposals should empty the buffer")
    void testClearProposals() {
        given()
            .contentType(ContentType.JSON)
            .body(Map.of("toolName", "extractEntityRelations", "payload", TOOL_PAYLOAD))
            .post(BASE + "/proposals");

        given().when().delete(BASE + "/proposals").then().statusCode(204);

        given()
        .when()
            .get(BASE + "/proposals")
        .then()
            .statusCode(200)
            .body("$", is(empty()));
    }

    @Test
    @DisplayName("POST /batches/apply should report missing notes and invalid rows per row")
    void testApplyReportsRowProblems() {
        String rows = """
            [
              {"id": "ghost", "notePath": "Characters/Ghost.md", "sourceField": "relations",
               "predicate": "rival_of", "targetPath": "Characters/Arin.md", "confidence": 72},
              {"id": "invalid", "notePath": "Characters/Arin.md", "sourceField": "relations",
               "predicate": "befriends", "targetPath": "Characters/Lira.md", "confidence": 150}
            ]
            """;

        given()
            .contentType(ContentType.JSON)
            .body(rows)
        .when()
            .post(BASE + "/batches/apply")
        .then()
            .statusCode(200)
            .body("updatedNotes", equalTo(0))
            .body("skippedRows", equalTo(1))
            .body("errors", hasSize(1))
            .body("rowResults.find { it.rowId == 'ghost' }.status", equalTo("error"))
            .body("rowResults.find { it.rowId == 'invalid' }.status", equalTo("skipped"))
            .body("rowResults.find { it.rowId == 'invalid' }.reason",
                equalTo("Invalid predicate; Confidence out of range"));
    }
}
