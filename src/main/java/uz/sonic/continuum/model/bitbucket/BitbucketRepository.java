package uz.sonic.continuum.model.bitbucket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BitbucketRepository(
        String name,
        @JsonProperty("full_name") String fullName,
        BitbucketPushEvent.Links links
) {}
