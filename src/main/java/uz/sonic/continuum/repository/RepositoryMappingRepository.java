package uz.sonic.continuum.repository;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import uz.sonic.continuum.entity.RepositoryMapping;

import java.util.List;
import java.util.Optional;

public interface RepositoryMappingRepository extends JpaRepository<RepositoryMapping, Long> {

    @EntityGraph(attributePaths = "project")
    Optional<RepositoryMapping> findByRepositoryUrlAndActiveTrue(String repositoryUrl);

    @EntityGraph(attributePaths = "project")
    Optional<RepositoryMapping> findFirstByRepositoryNameIgnoreCaseAndActiveTrueOrderByIdAsc(String repositoryName);

    Optional<RepositoryMapping> findByRepositoryUrl(String repositoryUrl);

    List<RepositoryMapping> findByProject_IdAndActiveTrueOrderByIdAsc(Long projectId);
}
