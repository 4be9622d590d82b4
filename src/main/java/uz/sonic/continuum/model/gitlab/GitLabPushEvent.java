package uz.sonic.continuum.model.gitlab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import uz.sonic.continuum.model.PushPayload;

import java.util.List;

import static uz.sonic.continuum.util.CommitFieldUtils.firstNonBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitLabPushEvent(
        String ref,
        List<GitLabCommit> commits,
        Project project,
        Repository repository
) implements PushPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Project(
            String name,
            @JsonProperty("path_with_namespace") String pathWithNamespace,
            @JsonProperty("web_url") String webUrl
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(
            String name,
            String url,
            @JsonProperty("git_http_url") String gitHttpUrl,
            String homepage
    ) {}

    @Override
    public String repositoryUrl() {
        String fromRepository = repository == null ? null : firstNonBlank(repository.gitHttpUrl(), repository.url());
        return firstNonBlank(fromRepository, project == null ? null : project.webUrl());
    }

    @Override
    public String repositoryName() {
        return project == null ? null : firstNonBlank(project.pathWithNamespace(), project.name());
    }
}
