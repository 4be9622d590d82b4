package uz.sonic.continuum.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uz.sonic.continuum.entity.Project;
import uz.sonic.continuum.entity.RepositoryMapping;
import uz.sonic.continuum.exception.RepositoryAlreadyLinkedException;
import uz.sonic.continuum.exception.ResourceNotFoundException;
import uz.sonic.continuum.model.LinkRepositoryRequest;
import uz.sonic.continuum.model.RepositoryMappingResponse;
import uz.sonic.continuum.repository.ProjectRepository;
import uz.sonic.continuum.repository.RepositoryMappingRepository;
import uz.sonic.continuum.util.RepositoryUrls;

import java.util.List;

@Service
public class RepositoryMappingService {

    private static final Logger log = LoggerFactory.getLogger(RepositoryMappingService.class);

    private final RepositoryMappingRepository mappingRepository;
    private final ProjectRepository projectRepository;

    public RepositoryMappingService(
            RepositoryMappingRepository mappingRepository,
            ProjectRepository projectRepository) {
        this.mappingRepository = mappingRepository;
        this.projectRepository = projectRepository;
    }

    @Transactional
    public RepositoryMappingResponse link(Long projectId, LinkRepositoryRequest request) {
        String normalizedUrl = RepositoryUrls.normalize(request.repositoryUrl());

        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));

        mappingRepository.findByRepositoryUrl(normalizedUrl).ifPresent(existing -> {
            throw new RepositoryAlreadyLinkedException(normalizedUrl, existing.getProject().getId());
        });

        RepositoryMapping mapping = mappingRepository.save(new RepositoryMapping(
                project, normalizedUrl, request.repositoryName().strip(), request.provider()));
        log.info("Linked repository {} -> project {}", normalizedUrl, projectId);
        return RepositoryMappingResponse.from(mapping);
    }

    @Transactional(readOnly = true)
    public List<RepositoryMappingResponse> listActive(Long projectId) {
        if (!projectRepository.existsById(projectId)) {
            throw new ResourceNotFoundException("Project", projectId);
        }
        return mappingRepository.findByProject_IdAndActiveTrueOrderByIdAsc(projectId).stream()
                .map(RepositoryMappingResponse::from)
                .toList();
    }

    @Transactional
    public RepositoryMappingResponse setActive(Long mappingId, boolean active) {
        RepositoryMapping mapping = mappingRepository.findById(mappingId)
                .orElseThrow(() -> new ResourceNotFoundException("Repository", mappingId));
        mapping.setActive(active);
        mappingRepository.flush();
        log.info("Repository {} is now {}", mapping.getRepositoryUrl(), active ? "active" : "inactive");
        return RepositoryMappingResponse.from(mapping);
    }

    @Transactional
    public void unlink(Long mappingId) {
        RepositoryMapping mapping = mappingRepository.findById(mappingId)
                .orElseThrow(() -> new ResourceNotFoundException("Repository", mappingId));
        mappingRepository.delete(mapping);
        log.info("Removed repository mapping: {}", mapping.getRepositoryUrl());
    }
}
