package uz.sonic.continuum.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uz.sonic.continuum.entity.GitContribution;
import uz.sonic.continuum.exception.InvalidTaskLinkException;
import uz.sonic.continuum.exception.ResourceNotFoundException;
import uz.sonic.continuum.model.GitContributionResponse;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.repository.GitContributionRepository;
import uz.sonic.continuum.repository.TaskRepository;

import java.util.List;

@Service
public class GitContributionService {

    private static final Logger log = LoggerFactory.getLogger(GitContributionService.class);

    private final GitContributionRepository contributionRepository;
    private final TaskRepository taskRepository;

    public GitContributionService(GitContributionRepository contributionRepository, TaskRepository taskRepository) {
        this.contributionRepository = contributionRepository;
        this.taskRepository = taskRepository;
    }

    @Transactional(readOnly = true)
    public List<GitContributionResponse> search(Long projectId, Long userId, GitProvider provider) {
        return contributionRepository.search(projectId, userId, provider).stream()
                .map(GitContributionResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public GitContributionResponse get(Long id) {
        return GitContributionResponse.from(find(id));
    }

    @Transactional
    public GitContributionResponse linkTask(Long id, Long taskId) {
        GitContribution contribution = find(id);
        Long projectId = contribution.getProject().getId();
        if (taskId != null && !taskRepository.existsByIdAndProjectId(taskId, projectId)) {
            throw new InvalidTaskLinkException(taskId, projectId);
        }
        contribution.setTaskId(taskId);
        log.info("Contribution {} linked to task {}", id, taskId);
        return GitContributionResponse.from(contribution);
    }

    private GitContribution find(Long id) {
        return contributionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Contribution", id));
    }
}
