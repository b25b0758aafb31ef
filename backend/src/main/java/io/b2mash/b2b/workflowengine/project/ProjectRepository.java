package io.b2mash.b2b.workflowengine.project;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Project p WHERE p.id = :id")
  Optional<Project> findByIdForUpdate(@Param("id") UUID id);

  boolean existsByTemplateId(UUID templateId);

  boolean existsByWorkTypeId(UUID workTypeId);

  boolean existsByCurrentStatusIdIn(Collection<UUID> statusIds);
}
