package tech.idplane.platform.authorization.api;

import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.idplane.platform.idp.IdpAdminClient;

import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

@Tag("integration")
@QuarkusTest
class RoleResourceTest {

    @InjectMock
    IdpAdminClient idpClient;

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static String createRole(String name) {
        return given()
            .contentType(ContentType.JSON)
            .body("{\"name\": \"" + name + "\", \"description\": \"original\"}")
            .when()
            .post("/roles")
            .then()
            .statusCode(201)
            .extract()
            .path("id");
    }

    @Test
    @DisplayName("PUT /roles/{id} should rename the role and keep the description")
    void update_shouldRename() {
        String id = createRole("role-" + suffix());
        String newName = "renamed-" + suffix();

        given()
            .contentType(ContentType.JSON)
            .body("{\"name\": \"" + newName + "\"}")
            .when()
            .put("/roles/" + id)
            .then()
            .statusCode(200)
            .body("name", equalTo(newName))
            .body("description", equalTo("original"));
    }

    @Test
    @DisplayName("PUT /roles/{id} onto a taken name should be 409 ROLE_EXISTS")
    void update_shouldReturn409_whenNameTaken() {
        String taken = "role-" + suffix();
        createRole(taken);
        String id = createRole("role-" + suffix());

        given()
            .contentType(ContentType.JSON)
            .body("{\"name\": \"" + taken + "\"}")
            .when()
            .put("/roles/" + id)
            .then()
            .statusCode(409)
            .body("code", equalTo("ROLE_EXISTS"));
    }

    @Test
    @DisplayName("PUT /roles/{id} for an unknown role should be 404")
    void update_shouldReturn404_whenUnknown() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"description\": \"x\"}")
            .when()
            .put("/roles/rol_unknown")
            .then()
            .statusCode(404)
            .body("code", equalTo("ROLE_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /roles/{id}/services should list the accounts holding the role")
    void services_shouldListHolders() {
        String roleId = createRole("role-" + suffix());
        String clientId = "svc-" + suffix();
        String accountId = given()
            .contentType(ContentType.JSON)
            .body("{\"clientId\": \"" + clientId + "\", \"clientSecret\": \"s3cret\"}")
            .when()
            .post("/service-accounts")
            .then()
            .statusCode(201)
            .extract()
            .path("id");
        given().when().post("/service-accounts/" + accountId + "/roles/" + roleId).then().statusCode(200);

        given()
            .when()
            .get("/roles/" + roleId + "/services")
            .then()
            .statusCode(200)
            .body("clientId", contains(clientId));
    }

    @Test
    @DisplayName("GET /roles/{id}/services for an unknown role should be 404")
    void services_shouldReturn404_whenUnknown() {
        given()
            .when()
            .get("/roles/rol_unknown/services")
            .then()
            .statusCode(404)
            .body("code", equalTo("ROLE_NOT_FOUND"));
    }
}
