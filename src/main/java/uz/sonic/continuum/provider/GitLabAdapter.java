package uz.sonic.continuum.provider;

import org.springframework.stereotype.Component;
import uz.sonic.continuum.model.CommitInfo;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.model.gitlab.GitLabCommit;
import uz.sonic.continuum.model.gitlab.GitLabPushEvent;
import uz.sonic.continuum.util.CommitFieldUtils.Author;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static uz.sonic.continuum.util.CommitFieldUtils.*;
import static uz.sonic.continuum.util.WebhookSignatures.constantTimeEquals;
import static uz.sonic.continuum.util.WebhookSignatures.isBlank;

@Component
public final class GitLabAdapter implements ProviderAdapter<GitLabPushEvent> {

    private final PushPayloadReader reader;
    private final Clock clock;

    public GitLabAdapter(PushPayloadReader reader, Clock clock) {
        this.reader = reader;
        this.clock = clock;
    }

    @Override
    public GitProvider provider() {
        return GitProvider.GITLAB;
    }

    @Override
    public boolean verify(byte[] rawBody, String token, String configuredToken) {
        if (isBlank(token) || isBlank(configuredToken)) {
            return false;
        }
        return constantTimeEquals(configuredToken, token);
    }

    @Override
    public ParseResult<GitLabPushEvent> parse(byte[] rawBody) {
        ParseResult<GitLabPushEvent> result = reader.read(rawBody, GitLabPushEvent.class);
        if (!(result instanceof ParseResult.Parsed<GitLabPushEvent> parsed)) {
            return result;
        }
        GitLabPushEvent event = parsed.payload();
        if (isBlank(event.ref())) {
            return ParseResult.failed("Invalid payload structure: missing required field 'ref'");
        }
        if (event.commits() == null) {
            return ParseResult.failed("Invalid payload structure: missing required field 'commits'");
        }
        for (GitLabCommit commit : event.commits()) {
            if (commit == null || isBlank(commit.id())) {
                return ParseResult.failed("Invalid payload structure: commit ID is required");
            }
        }
        return result;
    }

    @Override
    public List<CommitInfo> normalize(GitLabPushEvent event) {
        String branch = branchFromRef(event.ref());
        List<CommitInfo> commits = new ArrayList<>(event.commits().size());

        for (GitLabCommit commit : event.commits()) {
            Author author = authorFromNode(commit.author());
            if (!author.hasEmail()) {
                author = new Author(
                        nullToEmpty(firstNonBlank(author.name(), commit.authorName())),
                        nullToEmpty(commit.authorEmail()));
            }

            commits.add(new CommitInfo(
                    commit.id().strip(),
                    nullToEmpty(commit.message()),
                    branch,
                    parseTimestamp(commit.timestamp(), GitProvider.GITLAB, clock),
                    author.email(),
                    author.name(),
                    commit.url()));
        }
        return commits;
    }
}
