package uz.sonic.continuum.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IngestionStats(
        int created,
        @JsonProperty("skipped_duplicates") int skippedDuplicates,
        @JsonProperty("skipped_no_user") int skippedNoUser,
        @JsonProperty("skipped_no_reply") int skippedNoReply,
        @JsonProperty("total_processed") int totalProcessed
) {}
