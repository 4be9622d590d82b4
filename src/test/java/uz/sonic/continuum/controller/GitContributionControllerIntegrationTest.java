package uz.sonic.continuum.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import uz.sonic.continuum.entity.AppUser;
import uz.sonic.continuum.entity.GitContribution;
import uz.sonic.continuum.entity.Project;
import uz.sonic.continuum.entity.Task;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.repository.GitContributionRepository;
import uz.sonic.continuum.repository.ProjectRepository;
import uz.sonic.continuum.repository.RepositoryMappingRepository;
import uz.sonic.continuum.repository.TaskRepository;
import uz.sonic.continuum.repository.UserRepository;

import java.time.OffsetDateTime;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "webhooks.github.secret=gh-secret",
        "webhooks.gitlab.secret=gl-token",
        "webhooks.bitbucket.secret=bb-secret",
        "spring.datasource.url=jdbc:h2:mem:contributiondb;DB_CLOSE_DELAY=-1"
})
class GitContributionControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private RepositoryMappingRepository mappingRepository;

    @Autowired
    private GitContributionRepository contributionRepository;

    private Project project;
    private Project otherProject;
    private AppUser ann;
    private GitContribution contribution;

    @BeforeEach
    void setUp() {
        contributionRepository.deleteAll();
        mappingRepository.deleteAll();
        taskRepository.deleteAll();
        userRepository.deleteAll();
        projectRepository.deleteAll();

        project = projectRepository.save(new Project("Widgets"));
        otherProject = projectRepository.save(new Project("Billing"));
        ann = userRepository.save(new AppUser("ann", "ann@acme.io", "Ann Lee"));
        contribution = contributionRepository.save(new GitContribution(ann, project, "a1b2c3d4", "main",
                "Fix login", GitProvider.GITHUB, "https://github.com/acme/widgets/commit/a1b2c3d4",
                OffsetDateTime.parse("2024-05-15T10:30:00Z")));
        contributionRepository.save(new GitContribution(ann, otherProject, "f0e1d2c3", "develop",
                "Invoice export", GitProvider.GITLAB, null, OffsetDateTime.parse("2024-05-16T09:00:00Z")));
    }

    @Test
    void listFiltersByProjectAndProvider() throws Exception {
        mockMvc.perform(get("/api/git-contributions").param("projectId", project.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].commit_hash").value("a1b2c3d4"))
                .andExpect(jsonPath("$[0].user_id").value(ann.getId()));

        mockMvc.perform(get("/api/git-contributions").param("provider", "gitlab"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].provider").value("gitlab"));

        mockMvc.perform(get("/api/git-contributions").param("userId", ann.getId().toString()))
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    void unknownProviderFilterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/git-contributions").param("provider", "svn"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getUnknownContributionIsNotFound() throws Exception {
        mockMvc.perform(get("/api/git-contributions/{id}", contribution.getId() + 1000))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Contribution with id " + (contribution.getId() + 1000)
                        + " not found"));
    }

    @Test
    void linksAndUnlinksTaskOfSameProject() throws Exception {
        Task task = taskRepository.save(new Task(project.getId(), "Login page"));

        mockMvc.perform(patch("/api/git-contributions/{id}/task", contribution.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task_id\": " + task.getId() + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task_id").value(task.getId()));

        mockMvc.perform(patch("/api/git-contributions/{id}/task", contribution.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task_id\": null}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task_id").value(nullValue()));
    }

    @Test
    void taskFromAnotherProjectIsRejected() throws Exception {
        Task foreign = taskRepository.save(new Task(otherProject.getId(), "Invoices"));

        mockMvc.perform(patch("/api/git-contributions/{id}/task", contribution.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task_id\": " + foreign.getId() + "}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/git-contributions/{id}", contribution.getId()))
                .andExpect(jsonPath("$.task_id").value(nullValue()));
    }
}
