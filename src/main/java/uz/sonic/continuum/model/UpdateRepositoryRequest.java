package uz.sonic.continuum.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record UpdateRepositoryRequest(@JsonProperty("is_active") @NotNull Boolean active) {}
