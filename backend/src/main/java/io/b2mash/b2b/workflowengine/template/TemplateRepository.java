package io.b2mash.b2b.workflowengine.template;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TemplateRepository extends JpaRepository<Template, UUID> {

  List<Template> findByFirmIdOrderByNameAsc(UUID firmId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Template t WHERE t.id = :id")
  Optional<Template> findByIdForUpdate(@Param("id") UUID id);
}
