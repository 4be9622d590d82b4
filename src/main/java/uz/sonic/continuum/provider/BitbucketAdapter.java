package uz.sonic.continuum.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import uz.sonic.continuum.model.CommitInfo;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.model.bitbucket.BitbucketCommit;
import uz.sonic.continuum.model.bitbucket.BitbucketPushEvent;
import uz.sonic.continuum.util.CommitFieldUtils.Author;

import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static uz.sonic.continuum.util.CommitFieldUtils.*;
import static uz.sonic.continuum.util.WebhookSignatures.*;

@Component
public final class BitbucketAdapter implements ProviderAdapter<BitbucketPushEvent> {

    private static final Logger log = LoggerFactory.getLogger(BitbucketAdapter.class);

    private final PushPayloadReader reader;
    private final Clock clock;

    public BitbucketAdapter(PushPayloadReader reader, Clock clock) {
        this.reader = reader;
        this.clock = clock;
    }

    @Override
    public GitProvider provider() {
        return GitProvider.BITBUCKET;
    }

    @Override
    public boolean verify(byte[] rawBody, String signature, String secret) {
        if (isBlank(signature) || isBlank(secret)) {
            return false;
        }
        try {
            return constantTimeEquals(hmacSha256Hex(secret, rawBody), signature.strip());
        } catch (GeneralSecurityException e) {
            log.error("Failed to compute Bitbucket signature", e);
            return false;
        }
    }

    @Override
    public ParseResult<BitbucketPushEvent> parse(byte[] rawBody) {
        return reader.read(rawBody, BitbucketPushEvent.class);
    }

    @Override
    public List<CommitInfo> normalize(BitbucketPushEvent event) {
        String branch = event.branch();
        if (isBlank(branch)) {
            log.warn("Could not extract branch from Bitbucket payload");
            return List.of();
        }

        List<CommitInfo> commits = new ArrayList<>();
        for (BitbucketCommit commit : event.commits()) {
            if (commit == null || isBlank(commit.hash())) {
                log.warn("Skipping commit with missing hash in Bitbucket payload");
                continue;
            }
            Author author = resolveAuthor(commit.author());
            commits.add(new CommitInfo(
                    commit.hash().strip(),
                    nullToEmpty(commit.message()),
                    branch,
                    parseTimestamp(firstNonBlank(commit.date(), commit.timestamp()), GitProvider.BITBUCKET, clock),
                    author.email(),
                    author.name(),
                    commit.htmlUrl()));
        }
        return commits;
    }

    private Author resolveAuthor(JsonNode author) {
        if (author == null || !author.isObject()) {
            return Author.EMPTY;
        }
        Author fromRaw = parseRawAuthor(text(author, "raw"));
        if (fromRaw.hasEmail()) {
            return fromRaw;
        }
        JsonNode user = author.get("user");
        if (user == null || !user.isObject()) {
            return fromRaw;
        }
        String email = firstNonBlank(text(user, "email_address"), text(user, "email"));
        String name = firstNonBlank(text(user, "display_name"), fromRaw.name());
        return new Author(nullToEmpty(name), nullToEmpty(email));
    }
}
