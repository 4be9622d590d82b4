package uz.sonic.continuum.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import uz.sonic.continuum.entity.GitContribution;

import java.time.OffsetDateTime;

public record GitContributionResponse(
        Long id,
        @JsonProperty("user_id") Long userId,
        @JsonProperty("project_id") Long projectId,
        @JsonProperty("task_id") Long taskId,
        @JsonProperty("commit_hash") String commitHash,
        String branch,
        @JsonProperty("commit_message") String commitMessage,
        GitProvider provider,
        @JsonProperty("commit_url") String commitUrl,
        @JsonProperty("committed_at") OffsetDateTime committedAt,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {

    public static GitContributionResponse from(GitContribution contribution) {
        return new GitContributionResponse(
                contribution.getId(),
                contribution.getUser() == null ? null : contribution.getUser().getId(),
                contribution.getProject().getId(),
                contribution.getTaskId(),
                contribution.getCommitHash(),
                contribution.getBranch(),
                contribution.getCommitMessage(),
                contribution.getProvider(),
                contribution.getCommitUrl(),
                contribution.getCommittedAt(),
                contribution.getCreatedAt());
    }
}
