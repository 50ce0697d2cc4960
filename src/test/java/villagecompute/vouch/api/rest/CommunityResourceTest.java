package villagecompute.vouch.api.rest;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.services.UserDirectoryService;
import villagecompute.vouch.services.VouchLedgerService;
import villagecompute.vouch.testing.H2TestResource;
import villagecompute.vouch.testing.TestFixtures;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static villagecompute.vouch.testing.TestFixtures.*;

/**
 * Integration tests for the public leaderboard, growth and share-tracking endpoints.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class CommunityResourceTest {

    @Inject
    UserDirectoryService directory;

    @Inject
    VouchLedgerService ledger;

    @BeforeEach
    @Transactional
    public void setUp() {
        TestFixtures.deleteAll();
        directory.getOrCreate(ALICE_ID, "alice", "Alice", null, null);
        directory.getOrCreate(BOB_ID, "bob", "Bob", null, ALICE_ID);
    }

    @Test
    public void testLeaderboard() {
        ledger.createVouch(ALICE_ID, BOB_ID, null, null);

        given().when().get("/api/leaderboard").then().statusCode(200)
                .body("most_vouched[0].user_id", equalTo(BOB_ID.intValue()))
                .body("most_vouched[0].count", equalTo(1)).body("most_vouched[0].rank_emoji", notNullValue())
                .body("top_helpers", hasSize(1)).body("top_helpers[0].user_id", equalTo(ALICE_ID.intValue()));
    }

    @Test
    public void testGrowth() {
        ledger.createVouch(ALICE_ID, BOB_ID, null, null);

        given().when().get("/api/growth").then().statusCode(200).body("vouches_today", equalTo(1))
                .body("referral_signups", equalTo(1)).body("recent_activity", hasSize(1));
    }

    @Test
    public void testShare_logsEvent() {
        given().queryParam("user_id", ALICE_ID).queryParam("platform", "telegram").when().post("/api/share").then()
                .statusCode(200).body("success", equalTo(true));

        assertEquals(1, eventCount(DomainEvent.TYPE_SHARE_CLICKED, ALICE_ID));
    }

    @Test
    public void testShare_missingParams_badRequest() {
        given().queryParam("user_id", ALICE_ID).when().post("/api/share").then().statusCode(400);
    }
}
