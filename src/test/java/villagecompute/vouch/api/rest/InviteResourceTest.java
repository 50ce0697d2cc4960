package villagecompute.vouch.api.rest;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.vouch.services.UserDirectoryService;
import villagecompute.vouch.testing.H2TestResource;
import villagecompute.vouch.testing.TestFixtures;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static villagecompute.vouch.testing.TestFixtures.*;

@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class InviteResourceTest {

    @Inject
    UserDirectoryService directory;

    @BeforeEach
    @Transactional
    public void setUp() {
        TestFixtures.deleteAll();
    }

    @Test
    public void testSendInvite_thenCooldown() {
        directory.getOrCreate(ALICE_ID, "alice", null, null, null);

        given().contentType(ContentType.JSON).body(Map.of("from_user_id", ALICE_ID, "to_username", "@Pal")).when()
                .post("/api/invites").then().statusCode(201).body("invite.to_username", equalTo("pal"))
                .body("invite.from_user_id", equalTo(ALICE_ID.intValue()));

        given().contentType(ContentType.JSON).body(Map.of("from_user_id", ALICE_ID, "to_username", "pal")).when()
                .post("/api/invites").then().statusCode(429)
                .body("error", equalTo("You can only invite @pal once every 7 days"));
    }

    @Test
    public void testSendInvite_errors() {
        directory.getOrCreate(ALICE_ID, "alice", null, null, null);

        given().contentType(ContentType.JSON).body(Map.of("from_user_id", ALICE_ID, "to_username", "")).when()
                .post("/api/invites").then().statusCode(400);

        given().contentType(ContentType.JSON).body(Map.of("from_user_id", ALICE_ID, "to_username", "@")).when()
                .post("/api/invites").then().statusCode(400);

        given().contentType(ContentType.JSON).body(Map.of("from_user_id", 4242, "to_username", "pal")).when()
                .post("/api/invites").then().statusCode(404);
    }
}
