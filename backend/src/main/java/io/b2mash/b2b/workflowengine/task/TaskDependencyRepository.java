package io.b2mash.b2b.workflowengine.task;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TaskDependencyRepository extends JpaRepository<TaskDependency, UUID> {

  List<TaskDependency> findByFirmId(UUID firmId);

  List<TaskDependency> findByTaskId(UUID taskId);

  Optional<TaskDependency> findByTaskIdAndDependsOnTaskId(UUID taskId, UUID dependsOnTaskId);
}
