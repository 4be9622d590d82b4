package uz.sonic.continuum.model.gitlab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitLabCommit(
        String id,
        String message,
        String timestamp,
        String url,
        JsonNode author,
        @JsonProperty("author_name") String authorName,
        @JsonProperty("author_email") String authorEmail
) {}
