package uz.sonic.continuum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum GitProvider {

    GITHUB("github", "X-GitHub-Event", "push", "X-Hub-Signature-256", "%s/commit/%s"),
    GITLAB("gitlab", "X-Gitlab-Event", "Push Hook", "X-Gitlab-Token", "%s/-/commit/%s"),
    BITBUCKET("bitbucket", "X-Event-Key", "repo:push", "X-Hub-Signature", "%s/commits/%s");

    private final String id;
    private final String eventHeader;
    private final String pushEvent;
    private final String credentialHeader;
    private final String commitUrlTemplate;

    GitProvider(String id, String eventHeader, String pushEvent, String credentialHeader, String commitUrlTemplate) {
        this.id = id;
        this.eventHeader = eventHeader;
        this.pushEvent = pushEvent;
        this.credentialHeader = credentialHeader;
        this.commitUrlTemplate = commitUrlTemplate;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String eventHeader() {
        return eventHeader;
    }

    public String credentialHeader() {
        return credentialHeader;
    }

    public boolean isPushEvent(String event) {
        return pushEvent.equals(event);
    }

    public String commitUrl(String repositoryWebUrl, String commitHash) {
        return String.format(commitUrlTemplate, repositoryWebUrl, commitHash);
    }

    public String webhookPath() {
        return "/webhooks/" + id;
    }

    public static Optional<GitProvider> fromWebhookPath(String path) {
        return Arrays.stream(values())
                .filter(p -> p.webhookPath().equals(path))
                .findFirst();
    }

    @JsonCreator
    public static GitProvider fromId(String id) {
        return Arrays.stream(values())
                .filter(p -> p.id.equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown git provider: " + id));
    }
}
