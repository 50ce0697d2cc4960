package villagecompute.vouch.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.services.AnalyticsService;
import villagecompute.vouch.services.EventLogService;

import java.util.Map;

import static villagecompute.vouch.services.EventLogService.metadata;

/**
 * Public community endpoints: leaderboard, growth summary and share tracking.
 */
@Path("/api")
@Tag(
        name = "Community",
        description = "Invites, shares, leaderboards and growth")
@Produces(MediaType.APPLICATION_JSON)
public class CommunityResource {

    @Inject
    AnalyticsService analyticsService;

    @Inject
    EventLogService eventLog;

    @GET
    @Path("/leaderboard")
    @Operation(
            summary = "Leaderboard",
            description = "Most vouched users and the most active vouchers of the last 7 days")
    public Response leaderboard() {
        return Response.ok(analyticsService.leaderboard()).build();
    }

    @GET
    @Path("/growth")
    public Response growth() {
        return Response.ok(analyticsService.growthSummary()).build();
    }

    @POST
    @Path("/share")
    @Operation(
            summary = "Record a share click")
    public Response share(@QueryParam("user_id") Long userId, @QueryParam("platform") String platform) {
        if (userId == null || platform == null || platform.isBlank()) {
            return ErrorResponses.error(Response.Status.BAD_REQUEST, "user_id and platform are required");
        }
        eventLog.log(DomainEvent.TYPE_SHARE_CLICKED, userId, metadata("platform", platform));
        return Response.ok(Map.of("success", true)).build();
    }
}
