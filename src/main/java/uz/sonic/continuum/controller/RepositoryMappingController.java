package uz.sonic.continuum.controller;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uz.sonic.continuum.model.LinkRepositoryRequest;
import uz.sonic.continuum.model.RepositoryMappingResponse;
import uz.sonic.continuum.model.UpdateRepositoryRequest;
import uz.sonic.continuum.service.RepositoryMappingService;

import java.util.List;

@RestController
@RequestMapping("/api")
public class RepositoryMappingController {

    private final RepositoryMappingService mappingService;

    public RepositoryMappingController(RepositoryMappingService mappingService) {
        this.mappingService = mappingService;
    }

    @PostMapping("/projects/{projectId}/repositories")
    public ResponseEntity<RepositoryMappingResponse> link(
            @PathVariable Long projectId,
            @Valid @RequestBody LinkRepositoryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mappingService.link(projectId, request));
    }

    @GetMapping("/projects/{projectId}/repositories")
    public List<RepositoryMappingResponse> list(@PathVariable Long projectId) {
        return mappingService.listActive(projectId);
    }

    @PatchMapping("/repositories/{repositoryId}")
    public RepositoryMappingResponse update(
            @PathVariable Long repositoryId,
            @Valid @RequestBody UpdateRepositoryRequest request) {
        return mappingService.setActive(repositoryId, request.active());
    }

    @DeleteMapping("/repositories/{repositoryId}")
    public ResponseEntity<Void> unlink(@PathVariable Long repositoryId) {
        mappingService.unlink(repositoryId);
        return ResponseEntity.noContent().build();
    }
}
