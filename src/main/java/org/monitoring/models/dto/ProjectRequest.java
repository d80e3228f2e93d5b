package org.monitoring.models.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ProjectRequest(
        @NotBlank @Size(max = 120) String ownerRef,
        @NotBlank @Size(max = 255) String name,
        String description,
        Boolean isPublic,
        @Pattern(regexp = "^[a-z0-9][a-z0-9-]{0,79}$", message = "must be lowercase letters, digits and dashes")
        String publicSlug
) {
}
