package villagecompute.vouch.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.vouch.api.types.InviteRequestType;
import villagecompute.vouch.data.models.Invite;
import villagecompute.vouch.exceptions.InvalidRequestException;
import villagecompute.vouch.exceptions.RateLimitException;
import villagecompute.vouch.exceptions.ResourceNotFoundException;
import villagecompute.vouch.services.InviteService;

import java.util.Map;

@Path("/api/invites")
@Tag(
        name = "Community",
        description = "Invites, shares, leaderboards and growth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class InviteResource {

    @Inject
    InviteService inviteService;

    @POST
    @Operation(
            summary = "Record an invite",
            description = "Each user may invite a given username once every 7 days")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Invite recorded"),
                    @APIResponse(
                            responseCode = "429",
                            description = "Username already invited within the cooldown")})
    public Response sendInvite(@Valid @NotNull InviteRequestType request) {
        try {
            Invite invite = inviteService.sendInvite(request.fromUserId(), request.toUsername());
            return Response.status(Response.Status.CREATED)
                    .entity(Map.of("invite", invite.toSnapshot(), "message", "Invite recorded")).build();
        } catch (InvalidRequestException | ResourceNotFoundException | RateLimitException e) {
            return ErrorResponses.fromException(e);
        }
    }
}
