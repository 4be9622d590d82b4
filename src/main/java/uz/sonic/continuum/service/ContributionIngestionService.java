package uz.sonic.continuum.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import uz.sonic.continuum.entity.GitContribution;
import uz.sonic.continuum.entity.Project;
import uz.sonic.continuum.exception.ContributionPersistenceException;
import uz.sonic.continuum.model.CommitInfo;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.model.IngestionStats;
import uz.sonic.continuum.repository.GitContributionRepository;
import uz.sonic.continuum.repository.ProjectRepository;
import uz.sonic.continuum.util.RepositoryUrls;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes one delivery's contributions in a single transaction. A commit that fails is skipped on its
 * own; a unique-constraint conflict re-runs the batch so the raced commits count as duplicates.
 */
@Service
public class ContributionIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ContributionIngestionService.class);

    static final int MAX_ATTEMPTS = 3;

    private final ContributorResolver contributorResolver;
    private final GitContributionRepository contributionRepository;
    private final ProjectRepository projectRepository;
    private final TransactionTemplate transactionTemplate;

    public ContributionIngestionService(
            ContributorResolver contributorResolver,
            GitContributionRepository contributionRepository,
            ProjectRepository projectRepository,
            TransactionTemplate transactionTemplate) {
        this.contributorResolver = contributorResolver;
        this.contributionRepository = contributionRepository;
        this.projectRepository = projectRepository;
        this.transactionTemplate = transactionTemplate;
    }

    public IngestionStats ingest(List<CommitInfo> commits, Long projectId, GitProvider provider, String repositoryUrl) {
        IngestionStats stats = null;
        for (int attempt = 1; stats == null; attempt++) {
            try {
                stats = transactionTemplate.execute(status -> ingestBatch(commits, projectId, provider, repositoryUrl));
            } catch (DataIntegrityViolationException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    log.error("Contributions for project {} still conflict after {} attempts", projectId, attempt, e);
                    throw new ContributionPersistenceException("Failed to persist contributions", e);
                }
                log.warn("Contribution conflict while persisting batch for project {}, re-running against committed rows",
                        projectId);
            } catch (DataAccessException | TransactionException e) {
                log.error("Error committing contributions for project {}", projectId, e);
                throw new ContributionPersistenceException("Failed to persist contributions", e);
            }
        }

        log.info("Webhook processing complete: {} created, {} skipped (duplicates), {} skipped (no user), "
                        + "{} skipped (no-reply)",
                stats.created(), stats.skippedDuplicates(), stats.skippedNoUser(), stats.skippedNoReply());
        return stats;
    }

    private IngestionStats ingestBatch(List<CommitInfo> commits, Long projectId,
                                       GitProvider provider, String repositoryUrl) {
        Project project = projectRepository.getReferenceById(projectId);
        String repositoryWebUrl = RepositoryUrls.webUrl(repositoryUrl);

        List<GitContribution> staged = new ArrayList<>();
        Set<String> seenHashes = new HashSet<>();
        int duplicates = 0;
        int noUser = 0;
        int noReply = 0;

        for (CommitInfo commit : commits) {
            try {
                if (commit.hash() == null || commit.hash().isBlank()) {
                    throw new IllegalArgumentException("Commit hash is missing");
                }
                checkLength("commit hash", commit.hash(), GitContribution.COMMIT_HASH_MAX_LENGTH);
                checkLength("branch", commit.branch(), GitContribution.BRANCH_MAX_LENGTH);

                ContributorMatch match = contributorResolver.resolve(commit.authorEmail());
                if (match instanceof ContributorMatch.NoReply) {
                    log.debug("Skipping commit {}: no-reply email {}", commit.shortHash(), commit.authorEmail());
                    noReply++;
                    continue;
                }
                if (!(match instanceof ContributorMatch.Matched matched)) {
                    log.debug("Skipping commit {}: no user found for email {}", commit.shortHash(), commit.authorEmail());
                    noUser++;
                    continue;
                }

                if (!seenHashes.add(commit.hash())
                        || contributionRepository.existsByProject_IdAndCommitHash(projectId, commit.hash())) {
                    log.debug("Skipping duplicate commit {} (already exists)", commit.shortHash());
                    duplicates++;
                    continue;
                }

                staged.add(new GitContribution(
                        matched.user(),
                        project,
                        commit.hash(),
                        commit.branch(),
                        truncate(commit.message(), GitContribution.COMMIT_MESSAGE_MAX_LENGTH),
                        provider,
                        fittingUrl(commitUrl(commit, provider, repositoryWebUrl), commit),
                        commit.timestamp()));
                log.info("Staged contribution for commit {} (user: {}, project: {})",
                        commit.shortHash(), matched.user().getId(), projectId);
            } catch (DataAccessException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error processing commit {}", commit == null ? "unknown" : commit.shortHash(), e);
            }
        }

        contributionRepository.saveAllAndFlush(staged);
        return new IngestionStats(staged.size(), duplicates, noUser, noReply, commits.size());
    }

    private static void checkLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new IllegalArgumentException(field + " exceeds " + maxLength + " characters");
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        int end = Character.isHighSurrogate(value.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
        return value.substring(0, end);
    }

    private static String fittingUrl(String url, CommitInfo commit) {
        if (url != null && url.length() > GitContribution.COMMIT_URL_MAX_LENGTH) {
            log.warn("Dropping over-long commit URL for {}", commit.shortHash());
            return null;
        }
        return url;
    }

    static String commitUrl(CommitInfo commit, GitProvider provider, String repositoryWebUrl) {
        if (commit.url() != null && !commit.url().isBlank()) {
            return commit.url();
        }
        if (repositoryWebUrl == null) {
            return null;
        }
        return provider.commitUrl(repositoryWebUrl, commit.hash());
    }
}
