package uz.sonic.continuum.provider;

import uz.sonic.continuum.model.CommitInfo;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.model.PushPayload;

import java.util.List;

public sealed interface ProviderAdapter<P extends PushPayload>
        permits GitHubAdapter, GitLabAdapter, BitbucketAdapter {

    GitProvider provider();

    /**
     * Checks the credential header against the configured secret over the raw request bytes.
     * Returns {@code false} when either side is missing.
     */
    boolean verify(byte[] rawBody, String providedCredential, String configuredSecret);

    ParseResult<P> parse(byte[] rawBody);

    List<CommitInfo> normalize(P payload);
}
