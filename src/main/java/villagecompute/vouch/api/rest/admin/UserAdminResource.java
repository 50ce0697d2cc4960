package villagecompute.vouch.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.vouch.api.rest.ErrorResponses;
import villagecompute.vouch.api.types.AdminRankChangeType;
import villagecompute.vouch.api.types.AdminVouchAdjustmentType;
import villagecompute.vouch.api.types.RankChangeType;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.data.models.RankEvent;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.exceptions.InvalidRequestException;
import villagecompute.vouch.exceptions.PermissionDeniedException;
import villagecompute.vouch.exceptions.ResourceNotFoundException;
import villagecompute.vouch.services.EventLogService;
import villagecompute.vouch.services.RankChange;
import villagecompute.vouch.services.UserDirectoryService;
import villagecompute.vouch.services.VouchLedgerService;

import java.util.List;

/**
 * Admin REST endpoints for rank and vouch-count corrections.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/users/{userId}/rank-history} – rank transitions, most recent first</li>
 * <li>{@code GET /admin/api/users/{userId}/events} – audit events attributed to the user</li>
 * <li>{@code PATCH /admin/api/users/{userId}/rank} – set a rank directly</li>
 * <li>{@code POST /admin/api/users/{userId}/vouch-adjustments} – correct the vouch total</li>
 * </ul>
 *
 * <p>
 * <b>Audit Trail:</b> every correction writes a rank_events row and/or an events row with the admin id.
 */
@Path("/admin/api/users")
@Tag(
        name = "Admin",
        description = "Analytics and corrections (admin id required)")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class UserAdminResource {

    private static final Logger LOG = Logger.getLogger(UserAdminResource.class);

    @Inject
    UserDirectoryService directory;

    @Inject
    VouchLedgerService ledger;

    @Inject
    EventLogService eventLog;

    @Inject
    AdminGuard adminGuard;

    @GET
    @Path("/{userId}/rank-history")
    public Response rankHistory(@PathParam("userId") Long userId, @QueryParam("admin_id") Long adminId) {
        try {
            adminGuard.requireAdmin(adminId);
            List<RankEvent.RankEventSnapshot> history = directory.rankHistory(userId).stream()
                    .map(RankEvent::toSnapshot).toList();
            return Response.ok(history).build();
        } catch (PermissionDeniedException | ResourceNotFoundException e) {
            return ErrorResponses.fromException(e);
        }
    }

    @GET
    @Path("/{userId}/events")
    public Response events(@PathParam("userId") Long userId, @QueryParam("admin_id") Long adminId,
            @QueryParam("limit") @DefaultValue("50") int limit) {
        try {
            adminGuard.requireAdmin(adminId);
        } catch (PermissionDeniedException e) {
            return ErrorResponses.fromException(e);
        }

        List<DomainEvent.DomainEventSnapshot> events = eventLog.recentForUser(userId, limit).stream()
                .map(DomainEvent::toSnapshot).toList();
        return Response.ok(events).build();
    }

    @PATCH
    @Path("/{userId}/rank")
    @Operation(
            summary = "Set rank",
            description = "Administrative rank correction; always recorded in rank history")
    public Response setRank(@PathParam("userId") Long userId, @QueryParam("admin_id") Long adminId,
            @Valid @NotNull AdminRankChangeType request) {
        try {
            adminGuard.requireAdmin(adminId);
            User user = directory.updateRank(userId, request.rank());
            LOG.infof("Admin %d set rank for user %d to %s: %s", adminId, userId, request.rank(), request.reason());
            return Response.ok(user.toSnapshot()).build();
        } catch (PermissionDeniedException | InvalidRequestException | ResourceNotFoundException e) {
            return ErrorResponses.fromException(e);
        }
    }

    @POST
    @Path("/{userId}/vouch-adjustments")
    @Operation(
            summary = "Adjust vouch total",
            description = "Adds or removes vouches from a user's total (floored at 0) and recomputes the rank")
    public Response adjustVouches(@PathParam("userId") Long userId, @QueryParam("admin_id") Long adminId,
            @Valid @NotNull AdminVouchAdjustmentType request) {
        try {
            adminGuard.requireAdmin(adminId);
            RankChange change = ledger.adminAdjustVouchCount(userId, request.delta(), request.reason(), adminId);
            return Response.ok(RankChangeType.from(change)).build();
        } catch (PermissionDeniedException | InvalidRequestException | ResourceNotFoundException e) {
            return ErrorResponses.fromException(e);
        }
    }
}
