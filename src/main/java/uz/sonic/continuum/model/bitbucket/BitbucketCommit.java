package uz.sonic.continuum.model.bitbucket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BitbucketCommit(
        String hash,
        String message,
        String date,
        String timestamp,
        JsonNode author,
        BitbucketPushEvent.Links links
) {

    public String htmlUrl() {
        return links == null || links.html() == null ? null : links.html().href();
    }
}
