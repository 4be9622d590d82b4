package uz.sonic.continuum.model;

import java.time.OffsetDateTime;

public record CommitInfo(
        String hash,
        String message,
        String branch,
        OffsetDateTime timestamp,
        String authorEmail,
        String authorName,
        String url
) {

    public String shortHash() {
        return hash == null ? "unknown" : hash.substring(0, Math.min(8, hash.length()));
    }
}
