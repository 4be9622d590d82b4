package uz.sonic.continuum.model.github;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubCommit(
        @JsonAlias("sha") String id,
        String message,
        String timestamp,
        String url,
        JsonNode author,
        JsonNode committer
) {}
