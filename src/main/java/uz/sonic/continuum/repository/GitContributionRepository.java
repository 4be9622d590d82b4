package uz.sonic.continuum.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uz.sonic.continuum.entity.GitContribution;
import uz.sonic.continuum.model.GitProvider;

import java.util.List;

public interface GitContributionRepository extends JpaRepository<GitContribution, Long> {

    boolean existsByProject_IdAndCommitHash(Long projectId, String commitHash);

    long countByProject_Id(Long projectId);

    @Query("""
            select c from GitContribution c
            where (:projectId is null or c.project.id = :projectId)
              and (:userId is null or c.user.id = :userId)
              and (:provider is null or c.provider = :provider)
            order by c.createdAt desc, c.id desc
            """)
    List<GitContribution> search(@Param("projectId") Long projectId,
                                 @Param("userId") Long userId,
                                 @Param("provider") GitProvider provider);
}
