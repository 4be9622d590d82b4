package uz.sonic.continuum.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import uz.sonic.continuum.model.PushPayload;

import java.util.List;

import static uz.sonic.continuum.util.CommitFieldUtils.firstNonBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubPushEvent(
        String ref,
        List<GitHubCommit> commits,
        GitHubRepository repository
) implements PushPayload {

    @Override
    public String repositoryUrl() {
        return repository == null ? null : firstNonBlank(repository.cloneUrl(), repository.htmlUrl());
    }

    @Override
    public String repositoryName() {
        return repository == null ? null : firstNonBlank(repository.fullName(), repository.name());
    }
}
