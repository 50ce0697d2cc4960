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
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.vouch.api.types.ProfileUpdateRequestType;
import villagecompute.vouch.api.types.UserRequestType;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.exceptions.InvalidRequestException;
import villagecompute.vouch.exceptions.ResourceNotFoundException;
import villagecompute.vouch.services.AnalyticsService;
import villagecompute.vouch.services.ProfileService;
import villagecompute.vouch.services.UserDirectoryService;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for users and profiles.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /api/users} – register an interaction (get-or-create)</li>
 * <li>{@code GET /api/users} – list users by vouch count</li>
 * <li>{@code GET /api/users/search?q=} – search by username or name</li>
 * <li>{@code GET /api/users/{userId}} – user record</li>
 * <li>{@code GET /api/users/{userId}/profile} – profile with vouches and rank progress</li>
 * <li>{@code PATCH /api/users/{userId}/profile} – edit bio, location, picture</li>
 * <li>{@code GET /api/users/{userId}/referrals} – referral statistics</li>
 * </ul>
 */
@Path("/api/users")
@Tag(
        name = "Users",
        description = "Registration, profiles and search")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class UserResource {

    private static final int MAX_PAGE_SIZE = 100;

    @Inject
    UserDirectoryService directory;

    @Inject
    ProfileService profileService;

    @Inject
    AnalyticsService analyticsService;

    @POST
    @Operation(
            summary = "Register an interaction",
            description = "Creates the user on first contact, otherwise refreshes activity and username")
    public Response getOrCreate(@Valid @NotNull UserRequestType request) {
        try {
            User user = directory.getOrCreate(request.userId(), request.username(), request.firstName(),
                    request.lastName(), request.referrerId());
            return Response.ok(user.toSnapshot()).build();
        } catch (InvalidRequestException e) {
            return ErrorResponses.fromException(e);
        }
    }

    @GET
    public Response listUsers(@QueryParam("limit") @DefaultValue("100") int limit,
            @QueryParam("offset") @DefaultValue("0") int offset) {
        List<User.UserSnapshot> users = directory.listUsers(Math.min(limit, MAX_PAGE_SIZE), offset).stream()
                .map(User::toSnapshot).toList();
        return Response.ok(Map.of("users", users)).build();
    }

    @GET
    @Path("/search")
    @Operation(
            summary = "Search users",
            description = "Case-insensitive match on username, first name or last name")
    public Response searchUsers(@QueryParam("q") String query, @QueryParam("limit") @DefaultValue("20") int limit) {
        if (query == null || query.isBlank()) {
            return ErrorResponses.error(Response.Status.BAD_REQUEST, "Query parameter q is required");
        }
        List<User.UserSnapshot> users = directory.searchUsers(query, Math.min(limit, MAX_PAGE_SIZE)).stream()
                .map(User::toSnapshot).toList();
        return Response.ok(Map.of("users", users)).build();
    }

    @GET
    @Path("/{userId}")
    public Response getUser(@PathParam("userId") Long userId) {
        return directory.get(userId).map(user -> Response.ok(user.toSnapshot()).build())
                .orElseGet(() -> ErrorResponses.error(Response.Status.NOT_FOUND, "User not found: " + userId));
    }

    @GET
    @Path("/{userId}/profile")
    @Operation(
            summary = "User profile",
            description = "User record, vouches received and given, next rank threshold and progress")
    public Response getProfile(@PathParam("userId") Long userId) {
        try {
            return Response.ok(profileService.getProfile(userId)).build();
        } catch (ResourceNotFoundException e) {
            return ErrorResponses.fromException(e);
        }
    }

    @PATCH
    @Path("/{userId}/profile")
    @Operation(
            summary = "Edit profile",
            description = "Bio is truncated to 500 characters and location to 100")
    public Response updateProfile(@PathParam("userId") Long userId, ProfileUpdateRequestType request) {
        if (request == null) {
            return ErrorResponses.error(Response.Status.BAD_REQUEST, "No fields to update");
        }
        try {
            User user = directory.updateProfile(userId, request.bio(), request.location(),
                    request.profilePictureUrl());
            return Response.ok(user.toSnapshot()).build();
        } catch (InvalidRequestException | ResourceNotFoundException e) {
            return ErrorResponses.fromException(e);
        }
    }

    @GET
    @Path("/{userId}/referrals")
    public Response getReferrals(@PathParam("userId") Long userId) {
        return Response.ok(analyticsService.referralStats(userId)).build();
    }
}
