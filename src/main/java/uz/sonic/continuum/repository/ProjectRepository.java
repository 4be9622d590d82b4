package uz.sonic.continuum.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uz.sonic.continuum.entity.Project;

public interface ProjectRepository extends JpaRepository<Project, Long> {
}
