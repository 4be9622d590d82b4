package uz.sonic.continuum.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import uz.sonic.continuum.entity.AppUser;
import uz.sonic.continuum.entity.GitContribution;
import uz.sonic.continuum.entity.Project;
import uz.sonic.continuum.model.CommitInfo;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.model.IngestionStats;
import uz.sonic.continuum.repository.GitContributionRepository;
import uz.sonic.continuum.repository.ProjectRepository;
import uz.sonic.continuum.repository.RepositoryMappingRepository;
import uz.sonic.continuum.repository.TaskRepository;
import uz.sonic.continuum.repository.UserRepository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Runs ingestion against the real unique constraint. A second "delivery" is simulated by committing
 * the same commit in its own transaction while the first batch is still being staged.
 */
@SpringBootTest
@TestPropertySource(properties = {
        "webhooks.github.secret=gh-secret",
        "webhooks.gitlab.secret=gl-token",
        "webhooks.bitbucket.secret=bb-secret",
        "spring.datasource.url=jdbc:h2:mem:ingestiondb;DB_CLOSE_DELAY=-1"
})
class ContributionIngestionServiceIntegrationTest {

    private static final String REPO_URL = "https://github.com/acme/widgets.git";

    @MockBean
    private ContributorResolver contributorResolver;

    @Autowired
    private ContributionIngestionService ingestionService;

    @Autowired
    private GitContributionRepository contributionRepository;

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private RepositoryMappingRepository mappingRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private Project project;
    private AppUser ann;

    @BeforeEach
    void setUp() {
        contributionRepository.deleteAll();
        mappingRepository.deleteAll();
        taskRepository.deleteAll();
        userRepository.deleteAll();
        projectRepository.deleteAll();

        project = projectRepository.save(new Project("Widgets"));
        ann = userRepository.save(new AppUser("ann", "ann@acme.io", "Ann Lee"));
    }

    @Test
    void concurrentInsertOfSameCommitIsCountedAsDuplicate() {
        TransactionTemplate concurrentDelivery = new TransactionTemplate(transactionManager);
        concurrentDelivery.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        AtomicBoolean raced = new AtomicBoolean();

        when(contributorResolver.resolve("ann@acme.io")).thenReturn(new ContributorMatch.Matched(ann));
        // "aaa111" has already passed its existence check when the other delivery commits it.
        when(contributorResolver.resolve("late@acme.io")).thenAnswer(invocation -> {
            if (raced.compareAndSet(false, true)) {
                concurrentDelivery.executeWithoutResult(status -> contributionRepository.save(new GitContribution(
                        userRepository.getReferenceById(ann.getId()),
                        projectRepository.getReferenceById(project.getId()),
                        "aaa111", "main", "Fix login", GitProvider.GITHUB, null,
                        OffsetDateTime.parse("2024-05-15T10:30:00Z"))));
            }
            return new ContributorMatch.Matched(ann);
        });

        IngestionStats stats = ingestionService.ingest(List.of(
                commit("aaa111", "ann@acme.io", "main"),
                commit("bbb222", "late@acme.io", "main")), project.getId(), GitProvider.GITHUB, REPO_URL);

        assertThat(stats.created()).isEqualTo(1);
        assertThat(stats.skippedDuplicates()).isEqualTo(1);
        assertThat(stats.totalProcessed()).isEqualTo(2);
        assertThat(contributionRepository.findAll()).extracting(GitContribution::getCommitHash)
                .containsExactlyInAnyOrder("aaa111", "bbb222");
    }

    @Test
    void commitThatDoesNotFitTheSchemaDoesNotFailTheDelivery() {
        when(contributorResolver.resolve(anyString())).thenReturn(new ContributorMatch.Matched(ann));

        IngestionStats stats = ingestionService.ingest(List.of(
                commit("aaa111", "ann@acme.io", "main"),
                commit("bbb222", "ann@acme.io", "b".repeat(300)),
                commit("ccc333", "ann@acme.io", "main")), project.getId(), GitProvider.GITHUB, REPO_URL);

        assertThat(stats.created()).isEqualTo(2);
        assertThat(stats.totalProcessed()).isEqualTo(3);
        assertThat(contributionRepository.countByProject_Id(project.getId())).isEqualTo(2);
    }

    private static CommitInfo commit(String hash, String email, String branch) {
        return new CommitInfo(hash, "message " + hash, branch,
                OffsetDateTime.parse("2024-05-15T10:30:00Z"), email, "Author", null);
    }
}
