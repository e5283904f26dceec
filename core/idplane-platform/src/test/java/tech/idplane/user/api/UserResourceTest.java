package tech.idplane.user.api;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;

/**
 * HTTP tests for user administration.
 */
@Tag("integration")
@QuarkusTest
class UserResourceTest {

    private static String uniqueEmail() {
        return "user-" + UUID.randomUUID().toString().substring(0, 8) + "@example.com";
    }

    private static String createUser(String email) {
        return given()
            .contentType(ContentType.JSON)
            .body("{\"email\": \"" + email + "\", \"password\": \"s3cret-pass\", \"displayName\": \"Test user\"}")
            .when()
            .post("/users")
            .then()
            .statusCode(201)
            .extract()
            .path("id");
    }

    private static String createRole() {
        return given()
            .contentType(ContentType.JSON)
            .body("{\"name\": \"role-" + UUID.randomUUID().toString().substring(0, 8) + "\"}")
            .when()
            .post("/roles")
            .then()
            .statusCode(201)
            .extract()
            .path("id");
    }

    // ========================================================================
    // CRUD
    // ========================================================================

    @Test
    @DisplayName("POST /users should create a user without exposing the password hash")
    void create_shouldReturn201_withoutHash() {
        String email = uniqueEmail();

        given()
            .contentType(ContentType.JSON)
            .body("{\"email\": \"" + email.toUpperCase() + "\", \"password\": \"s3cret-pass\"}")
            .when()
            .post("/users")
            .then()
            .statusCode(201)
            .header("Location", notNullValue())
            .body("id", startsWith("usr_"))
            .body("email", equalTo(email))
            .body("active", equalTo(true))
            .body("$", not(hasKey("passwordHash")))
            .body("$", not(hasKey("password")));
    }

    @Test
    @DisplayName("POST /users with a taken email should be 409 EMAIL_EXISTS")
    void create_shouldReturn409_whenEmailTaken() {
        String email = uniqueEmail();
        createUser(email);

        given()
            .contentType(ContentType.JSON)
            .body("{\"email\": \"" + email + "\", \"password\": \"an0ther-pass\"}")
            .when()
            .post("/users")
            .then()
            .statusCode(409)
            .body("code", equalTo("EMAIL_EXISTS"));
    }

    @Test
    @DisplayName("POST /users with a short password should be 422")
    void create_shouldReturn422_whenPasswordShort() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"email\": \"" + uniqueEmail() + "\", \"password\": \"short\"}")
            .when()
            .post("/users")
            .then()
            .statusCode(422);
    }

    @Test
    @DisplayName("PUT /users/{id} should apply a partial update")
    void update_shouldChangeGivenFields() {
        String id = createUser(uniqueEmail());

        given()
            .contentType(ContentType.JSON)
            .body("{\"displayName\": \"Renamed\", \"active\": false}")
            .when()
            .put("/users/" + id)
            .then()
            .statusCode(200)
            .body("displayName", equalTo("Renamed"))
            .body("active", equalTo(false));
    }

    @Test
    @DisplayName("DELETE /users/{id} should remove the user")
    void delete_shouldReturn204_thenNotFound() {
        String id = createUser(uniqueEmail());

        given().when().delete("/users/" + id).then().statusCode(204);
        given().when().get("/users/" + id).then().statusCode(404).body("code", equalTo("USER_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /users should page the listing")
    void list_shouldRespectLimit() {
        createUser(uniqueEmail());
        createUser(uniqueEmail());

        given()
            .queryParam("limit", 1)
            .when()
            .get("/users")
            .then()
            .statusCode(200)
            .body("items", hasSize(1))
            .body("limit", equalTo(1));
    }

    // ========================================================================
    // Roles, locking and password
    // ========================================================================

    @Test
    @DisplayName("a granted role should show on the user and on the role's holder list")
    void assignRole_shouldLinkBothWays() {
        String id = createUser(uniqueEmail());
        String roleId = createRole();

        given()
            .when()
            .post("/users/" + id + "/roles/" + roleId)
            .then()
            .statusCode(200)
            .body("roles", hasSize(1))
            .body("roles[0].id", equalTo(roleId));

        given()
            .when()
            .get("/roles/" + roleId + "/users")
            .then()
            .statusCode(200)
            .body("id", hasItem(id));

        given()
            .when()
            .delete("/users/" + id + "/roles/" + roleId)
            .then()
            .statusCode(200)
            .body("roles", hasSize(0));
    }

    @Test
    @DisplayName("deleting a role should revoke it from its users")
    void deleteRole_shouldRevokeFromUsers() {
        String id = createUser(uniqueEmail());
        String roleId = createRole();
        given().when().post("/users/" + id + "/roles/" + roleId).then().statusCode(200);

        given().when().delete("/roles/" + roleId).then().statusCode(204);

        given()
            .when()
            .get("/users/" + id)
            .then()
            .statusCode(200)
            .body("roles", hasSize(0));
    }

    @Test
    @DisplayName("lock then unlock should set and clear lockedUntil")
    void lockAndUnlock_shouldToggleLock() {
        String id = createUser(uniqueEmail());

        given().when().post("/users/" + id + "/lock").then().statusCode(200).body("lockedUntil", notNullValue());
        given().when().post("/users/" + id + "/unlock").then().statusCode(200).body("lockedUntil", nullValue());
    }

    @Test
    @DisplayName("reset-password should be 204 and leave an audit entry without the password")
    void resetPassword_shouldAuditWithoutSecret() {
        String id = createUser(uniqueEmail());

        given()
            .contentType(ContentType.JSON)
            .body("{\"newPassword\": \"n3w-password-123\"}")
            .when()
            .post("/users/" + id + "/reset-password")
            .then()
            .statusCode(204);

        given()
            .when()
            .get("/users/" + id + "/audit-logs")
            .then()
            .statusCode(200)
            .body("items.action", hasItem("iam:user:password-reset"))
            .body("items.details", not(hasItem(containsString("n3w-password-123"))));
    }
}
