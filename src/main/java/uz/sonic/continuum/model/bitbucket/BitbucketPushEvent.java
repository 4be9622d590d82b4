package uz.sonic.continuum.model.bitbucket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import uz.sonic.continuum.model.PushPayload;

import java.util.List;
import java.util.Objects;

import static uz.sonic.continuum.util.CommitFieldUtils.firstNonBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BitbucketPushEvent(
        Push push,
        BitbucketRepository repository
) implements PushPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Push(List<Change> changes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Change(@JsonProperty("new") RefState newState) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RefState(String name, String type, List<BitbucketCommit> commits) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Links(Link html) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Link(String href) {}

    /**
     * Branch of the first change; {@code null} when the push carries no new ref state (e.g. a branch deletion).
     */
    public String branch() {
        if (push == null || push.changes() == null || push.changes().isEmpty()) {
            return null;
        }
        Change first = push.changes().get(0);
        return first == null || first.newState() == null ? null : first.newState().name();
    }

    public List<BitbucketCommit> commits() {
        if (push == null || push.changes() == null) {
            return List.of();
        }
        return push.changes().stream()
                .filter(Objects::nonNull)
                .map(Change::newState)
                .filter(state -> state != null && state.commits() != null)
                .flatMap(state -> state.commits().stream())
                .toList();
    }

    @Override
    public String repositoryUrl() {
        if (repository == null || repository.links() == null || repository.links().html() == null) {
            return null;
        }
        return repository.links().html().href();
    }

    @Override
    public String repositoryName() {
        return repository == null ? null : firstNonBlank(repository.fullName(), repository.name());
    }
}
