package villagecompute.vouch.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.vouch.api.rest.ErrorResponses;
import villagecompute.vouch.api.types.AnalyticsSummaryType;
import villagecompute.vouch.exceptions.PermissionDeniedException;
import villagecompute.vouch.services.AnalyticsService;

/**
 * Admin analytics dashboard endpoints.
 *
 * <p>
 * {@code GET /admin/api/analytics} returns the full community summary; nothing is cached.
 *
 * <p>
 * <b>Security:</b> {@code admin_id} must match the configured admin user.
 */
@Path("/admin/api/analytics")
@Tag(
        name = "Admin",
        description = "Analytics and corrections (admin id required)")
@Produces(MediaType.APPLICATION_JSON)
public class AnalyticsResource {

    private static final Logger LOG = Logger.getLogger(AnalyticsResource.class);

    @Inject
    AnalyticsService analyticsService;

    @Inject
    AdminGuard adminGuard;

    @GET
    @Operation(
            summary = "Community summary",
            description = "Users, activity windows, signups, vouches, rank histogram, leaderboards and mutual vouches")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Summary computed"),
                    @APIResponse(
                            responseCode = "403",
                            description = "Caller is not the admin")})
    public Response summary(@QueryParam("admin_id") Long adminId) {
        try {
            adminGuard.requireAdmin(adminId);
        } catch (PermissionDeniedException e) {
            return ErrorResponses.fromException(e);
        }

        AnalyticsSummaryType summary = analyticsService.summary();
        LOG.debugf("Admin %d fetched analytics summary", adminId);
        return Response.ok(summary).build();
    }
}
