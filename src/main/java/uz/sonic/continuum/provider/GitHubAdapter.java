package uz.sonic.continuum.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import uz.sonic.continuum.model.CommitInfo;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.model.github.GitHubCommit;
import uz.sonic.continuum.model.github.GitHubPushEvent;
import uz.sonic.continuum.util.CommitFieldUtils.Author;

import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static uz.sonic.continuum.util.CommitFieldUtils.*;
import static uz.sonic.continuum.util.WebhookSignatures.*;

@Component
public final class GitHubAdapter implements ProviderAdapter<GitHubPushEvent> {

    private static final Logger log = LoggerFactory.getLogger(GitHubAdapter.class);

    private static final String SIGNATURE_PREFIX = "sha256=";

    private final PushPayloadReader reader;
    private final Clock clock;

    public GitHubAdapter(PushPayloadReader reader, Clock clock) {
        this.reader = reader;
        this.clock = clock;
    }

    @Override
    public GitProvider provider() {
        return GitProvider.GITHUB;
    }

    @Override
    public boolean verify(byte[] rawBody, String signature, String secret) {
        if (isBlank(signature) || isBlank(secret) || !signature.startsWith(SIGNATURE_PREFIX)) {
            return false;
        }
        try {
            String expected = SIGNATURE_PREFIX + hmacSha256Hex(secret, rawBody);
            return constantTimeEquals(expected, signature);
        } catch (GeneralSecurityException e) {
            log.error("Failed to compute GitHub signature", e);
            return false;
        }
    }

    @Override
    public ParseResult<GitHubPushEvent> parse(byte[] rawBody) {
        ParseResult<GitHubPushEvent> result = reader.read(rawBody, GitHubPushEvent.class);
        if (!(result instanceof ParseResult.Parsed<GitHubPushEvent> parsed)) {
            return result;
        }
        GitHubPushEvent event = parsed.payload();
        if (isBlank(event.ref())) {
            return ParseResult.failed("Invalid payload structure: missing required field 'ref'");
        }
        if (event.commits() == null) {
            return ParseResult.failed("Invalid payload structure: missing required field 'commits'");
        }
        for (GitHubCommit commit : event.commits()) {
            if (commit == null || isBlank(commit.id())) {
                return ParseResult.failed("Invalid payload structure: commit SHA is required");
            }
        }
        return result;
    }

    @Override
    public List<CommitInfo> normalize(GitHubPushEvent event) {
        String branch = branchFromRef(event.ref());
        List<CommitInfo> commits = new ArrayList<>(event.commits().size());

        for (GitHubCommit commit : event.commits()) {
            Author author = authorFromNode(commit.author());
            if (!author.hasEmail()) {
                Author committer = authorFromNode(commit.committer());
                if (committer.hasEmail()) {
                    author = committer;
                }
            }
            if (commit.author() != null && !commit.author().isObject() && !commit.author().isNull()) {
                log.warn("Commit {} has a malformed author block", commit.id());
            }

            String timestamp = firstNonBlank(
                    commit.timestamp(),
                    text(commit.author(), "date"),
                    text(commit.committer(), "date"));

            commits.add(new CommitInfo(
                    commit.id().strip(),
                    nullToEmpty(commit.message()),
                    branch,
                    parseTimestamp(timestamp, GitProvider.GITHUB, clock),
                    author.email(),
                    author.name(),
                    commit.url()));
        }
        return commits;
    }
}
