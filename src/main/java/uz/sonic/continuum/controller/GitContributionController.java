package uz.sonic.continuum.controller;

import org.springframework.web.bind.annotation.*;
import uz.sonic.continuum.model.GitContributionResponse;
import uz.sonic.continuum.model.GitProvider;
import uz.sonic.continuum.model.LinkTaskRequest;
import uz.sonic.continuum.service.GitContributionService;

import java.util.List;

@RestController
@RequestMapping("/api/git-contributions")
public class GitContributionController {

    private final GitContributionService contributionService;

    public GitContributionController(GitContributionService contributionService) {
        this.contributionService = contributionService;
    }

    @GetMapping
    public List<GitContributionResponse> list(
            @RequestParam(required = false) Long projectId,
            @RequestParam(required = false) Long userId,
            @RequestParam(required = false) String provider) {
        GitProvider gitProvider = provider == null || provider.isBlank() ? null : GitProvider.fromId(provider);
        return contributionService.search(projectId, userId, gitProvider);
    }

    @GetMapping("/{id}")
    public GitContributionResponse get(@PathVariable Long id) {
        return contributionService.get(id);
    }

    @PatchMapping("/{id}/task")
    public GitContributionResponse linkTask(@PathVariable Long id, @RequestBody LinkTaskRequest request) {
        return contributionService.linkTask(id, request.taskId());
    }
}
