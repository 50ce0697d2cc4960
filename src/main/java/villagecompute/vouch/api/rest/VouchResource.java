package villagecompute.vouch.api.rest;

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
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.vouch.api.types.CreateVouchRequestType;
import villagecompute.vouch.api.types.UpdateVouchRequestType;
import villagecompute.vouch.api.types.VouchResultType;
import villagecompute.vouch.data.models.Vouch;
import villagecompute.vouch.exceptions.DuplicateVouchException;
import villagecompute.vouch.exceptions.InvalidRequestException;
import villagecompute.vouch.exceptions.PermissionDeniedException;
import villagecompute.vouch.exceptions.ResourceNotFoundException;
import villagecompute.vouch.exceptions.SelfVouchException;
import villagecompute.vouch.services.VouchLedgerService;
import villagecompute.vouch.services.VouchOutcome;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for vouches.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /api/vouches} – create a vouch by target id or username</li>
 * <li>{@code PATCH /api/vouches/{id}} – edit a vouch message (author only)</li>
 * <li>{@code GET /api/vouches/recent} – latest confirmed vouches</li>
 * </ul>
 */
@Path("/api/vouches")
@Tag(
        name = "Vouches",
        description = "Create and edit vouches")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class VouchResource {

    private static final Logger LOG = Logger.getLogger(VouchResource.class);

    private static final int MAX_RECENT = 100;

    @Inject
    VouchLedgerService ledger;

    @POST
    @Operation(
            summary = "Create a vouch",
            description = "Vouch for a user by id or username. Unknown usernames create a pending vouch.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Vouch created (confirmed or pending)"),
                    @APIResponse(
                            responseCode = "400",
                            description = "No target given, or self vouch"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Source or target user not found"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Duplicate vouch")})
    public Response createVouch(@Valid @NotNull CreateVouchRequestType request) {
        try {
            VouchOutcome outcome = ledger.createVouch(request.fromUserId(), request.toUserId(), request.toUsername(),
                    request.message());
            return Response.status(Response.Status.CREATED).entity(VouchResultType.from(outcome)).build();
        } catch (InvalidRequestException | SelfVouchException | DuplicateVouchException
                | ResourceNotFoundException e) {
            LOG.debugf("Vouch from user %d rejected: %s", request.fromUserId(), e.getMessage());
            return ErrorResponses.fromException(e);
        }
    }

    @PATCH
    @Path("/{id}")
    @Operation(
            summary = "Edit a vouch message")
    public Response updateVouch(@PathParam("id") Long id, @Valid @NotNull UpdateVouchRequestType request) {
        try {
            Vouch vouch = ledger.updateVouch(id, request.userId(), request.message());
            return Response.ok(vouch.toSnapshot()).build();
        } catch (ResourceNotFoundException | PermissionDeniedException e) {
            return ErrorResponses.fromException(e);
        }
    }

    @GET
    @Path("/recent")
    @Operation(
            summary = "Recent community activity",
            description = "Latest confirmed vouches, newest first")
    public Response recent(@QueryParam("limit") @DefaultValue("50") int limit) {
        int effectiveLimit = Math.max(1, Math.min(limit, MAX_RECENT));
        List<Vouch.VouchSnapshot> activity = ledger.recentActivity(effectiveLimit).stream().map(Vouch::toSnapshot)
                .toList();
        return Response.ok(Map.of("activity", activity)).build();
    }
}
