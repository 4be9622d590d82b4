package uz.sonic.continuum.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import uz.sonic.continuum.entity.Project;
import uz.sonic.continuum.entity.RepositoryMapping;
import uz.sonic.continuum.repository.RepositoryMappingRepository;
import uz.sonic.continuum.util.RepositoryUrls;

import java.util.Optional;

@Service
public class RepositoryResolver {

    private static final Logger log = LoggerFactory.getLogger(RepositoryResolver.class);

    private final RepositoryMappingRepository mappingRepository;

    public RepositoryResolver(RepositoryMappingRepository mappingRepository) {
        this.mappingRepository = mappingRepository;
    }

    public Optional<Project> resolve(String repositoryUrl, String repositoryName) {
        String normalizedUrl = RepositoryUrls.normalize(repositoryUrl);

        Optional<RepositoryMapping> mapping = normalizedUrl.isEmpty()
                ? Optional.empty()
                : mappingRepository.findByRepositoryUrlAndActiveTrue(normalizedUrl);
        if (mapping.isEmpty() && repositoryName != null && !repositoryName.isBlank()) {
            mapping = mappingRepository.findFirstByRepositoryNameIgnoreCaseAndActiveTrueOrderByIdAsc(repositoryName.strip());
        }

        if (mapping.isEmpty()) {
            log.warn("No project mapping found for repository: {}",
                    repositoryName != null ? repositoryName : repositoryUrl);
            return Optional.empty();
        }
        Project project = mapping.get().getProject();
        log.debug("Repository {} mapped to project {}", normalizedUrl, project.getId());
        return Optional.of(project);
    }
}
