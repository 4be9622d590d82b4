package uz.sonic.continuum.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import uz.sonic.continuum.model.GitProvider;

import java.time.OffsetDateTime;

/**
 * One commit attributed to a project member, unique per {@code (project_id, commit_hash)}.
 */
@Entity
@Table(name = "git_contributions",
        uniqueConstraints = @UniqueConstraint(name = "uix_project_commit", columnNames = {"project_id", "commit_hash"}))
public class GitContribution {

    public static final int COMMIT_HASH_MAX_LENGTH = 64;
    public static final int BRANCH_MAX_LENGTH = 255;
    public static final int COMMIT_MESSAGE_MAX_LENGTH = 65535;
    public static final int COMMIT_URL_MAX_LENGTH = 1024;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private AppUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Project project;

    @Column(name = "task_id")
    private Long taskId;

    @Column(name = "commit_hash", nullable = false, length = COMMIT_HASH_MAX_LENGTH)
    private String commitHash;

    @Column(length = BRANCH_MAX_LENGTH)
    private String branch;

    @Column(name = "commit_message", length = COMMIT_MESSAGE_MAX_LENGTH)
    private String commitMessage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private GitProvider provider;

    @Column(name = "commit_url", length = COMMIT_URL_MAX_LENGTH)
    private String commitUrl;

    @Column(name = "committed_at")
    private OffsetDateTime committedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public GitContribution() {
    }

    public GitContribution(AppUser user, Project project, String commitHash, String branch,
                           String commitMessage, GitProvider provider, String commitUrl,
                           OffsetDateTime committedAt) {
        this.user = user;
        this.project = project;
        this.commitHash = commitHash;
        this.branch = branch;
        this.commitMessage = commitMessage;
        this.provider = provider;
        this.commitUrl = commitUrl;
        this.committedAt = committedAt;
    }

    @PrePersist
    void onCreate() {
        createdAt = OffsetDateTime.now();
    }

    public Long getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public Project getProject() {
        return project;
    }

    public Long getTaskId() {
        return taskId;
    }

    public void setTaskId(Long taskId) {
        this.taskId = taskId;
    }

    public String getCommitHash() {
        return commitHash;
    }

    public String getBranch() {
        return branch;
    }

    public String getCommitMessage() {
        return commitMessage;
    }

    public GitProvider getProvider() {
        return provider;
    }

    public String getCommitUrl() {
        return commitUrl;
    }

    public OffsetDateTime getCommittedAt() {
        return committedAt;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
