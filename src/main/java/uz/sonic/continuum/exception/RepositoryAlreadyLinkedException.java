package uz.sonic.continuum.exception;

public class RepositoryAlreadyLinkedException extends RuntimeException {

    private final String repositoryUrl;
    private final Long projectId;

    public RepositoryAlreadyLinkedException(String repositoryUrl, Long projectId) {
        super("Repository with URL " + repositoryUrl + " is already linked to project " + projectId);
        this.repositoryUrl = repositoryUrl;
        this.projectId = projectId;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public Long getProjectId() {
        return projectId;
    }
}
