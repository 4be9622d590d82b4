package uz.sonic.continuum.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record LinkRepositoryRequest(
        @JsonProperty("repository_url") @NotBlank String repositoryUrl,
        @JsonProperty("repository_name") @NotBlank String repositoryName,
        @NotNull GitProvider provider
) {}
