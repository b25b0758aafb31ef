package io.b2mash.b2b.workflowengine.template;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TemplateTaskRepository extends JpaRepository<TemplateTask, UUID> {
  List<TemplateTask> findByTemplateIdOrderByPosition(UUID templateId);
}
