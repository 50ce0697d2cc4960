package villagecompute.vouch.api.rest;

import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

@Path("/api/health")
@Tag(
        name = "Health",
        description = "Health check operations")
public class HealthResource {

    private static final Logger LOG = Logger.getLogger(HealthResource.class);

    @Inject
    EntityManager entityManager;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Health check",
            description = "Check if the application is running and the database is reachable")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Application is healthy",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthResponse.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Database unreachable")})
    public Response health() {
        try {
            entityManager.createNativeQuery("SELECT 1").getSingleResult();
            return Response.ok(new HealthResponse("healthy", "vouch-portal", "connected")).build();
        } catch (PersistenceException e) {
            LOG.warnf(e, "Health check could not reach the database");
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new HealthResponse("unhealthy", "vouch-portal", "disconnected")).build();
        }
    }

    public record HealthResponse(String status, String service, String database) {
    }
}
