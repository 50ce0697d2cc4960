package villagecompute.vouch.config;

import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * OpenAPI 3.0 configuration for the Vouch Portal API.
 *
 * <p>
 * Defines API metadata and endpoint groupings via tags. The generated document is served at {@code /q/openapi}.
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Vouch Portal API",
                version = "1.0.0",
                description = """
                        Community trust service: members vouch for each other and earn rank tiers.

                        ## Features
                        - **Vouches**: vouch by user id or by username; usernames that have not joined yet hold a pending vouch
                        - **Ranks**: Unverified, Verified, Trusted, Endorsed and Top-Tier Verified at 0, 3, 6, 11 and 16 vouches
                        - **Profiles**: bio, location, picture, vouches given and received, progress to the next rank
                        - **Admin Tools**: community analytics, rank and vouch-count corrections

                        ## Errors
                        Failures return a JSON body `{"error": "..."}` with 400, 403, 404, 409 or 429.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Proprietary")),
        tags = {@Tag(
                name = "Vouches",
                description = "Create and edit vouches"),
                @Tag(
                        name = "Users",
                        description = "Registration, profiles and search"),
                @Tag(
                        name = "Community",
                        description = "Invites, shares, leaderboards and growth"),
                @Tag(
                        name = "Admin",
                        description = "Analytics and corrections (admin id required)"),
                @Tag(
                        name = "Health",
                        description = "Health check operations")})
public class OpenApiConfig extends Application {
}
