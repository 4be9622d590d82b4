package uz.sonic.continuum.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import uz.sonic.continuum.entity.RepositoryMapping;

import java.time.OffsetDateTime;

public record RepositoryMappingResponse(
        Long id,
        @JsonProperty("project_id") Long projectId,
        @JsonProperty("repository_url") String repositoryUrl,
        @JsonProperty("repository_name") String repositoryName,
        GitProvider provider,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt
) {

    public static RepositoryMappingResponse from(RepositoryMapping mapping) {
        return new RepositoryMappingResponse(
                mapping.getId(),
                mapping.getProject().getId(),
                mapping.getRepositoryUrl(),
                mapping.getRepositoryName(),
                mapping.getProvider(),
                mapping.isActive(),
                mapping.getCreatedAt(),
                mapping.getUpdatedAt());
    }
}
