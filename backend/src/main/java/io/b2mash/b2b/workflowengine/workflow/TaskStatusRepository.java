package io.b2mash.b2b.workflowengine.workflow;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TaskStatusRepository extends JpaRepository<TaskStatus, UUID> {

  List<TaskStatus> findByWorkTypeIdOrderByPosition(UUID workTypeId);
}
