package uz.sonic.continuum.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uz.sonic.continuum.entity.Task;

public interface TaskRepository extends JpaRepository<Task, Long> {

    boolean existsByIdAndProjectId(Long id, Long projectId);
}
