package io.b2mash.b2b.workflowengine.activity;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ActivityLogRepository extends JpaRepository<ActivityLog, UUID> {

  List<ActivityLog> findByProjectIdOrderByOccurredAtAsc(UUID projectId);

  List<ActivityLog> findByTaskIdOrderByOccurredAtAsc(UUID taskId);

  List<ActivityLog> findByFirmIdOrderByOccurredAtAsc(UUID firmId);
}
