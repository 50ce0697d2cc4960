package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for profile edits. Omitted fields are left unchanged.
 */
public record ProfileUpdateRequestType(@JsonProperty("bio") String bio, @JsonProperty("location") String location,
        @JsonProperty("profile_picture_url") String profilePictureUrl) {
}
