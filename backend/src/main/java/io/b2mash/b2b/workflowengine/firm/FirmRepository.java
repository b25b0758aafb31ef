package io.b2mash.b2b.workflowengine.firm;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FirmRepository extends JpaRepository<Firm, UUID> {

  /** Locks the firm row. Dependency edits take this lock to serialize graph changes per firm. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT f FROM Firm f WHERE f.id = :id")
  Optional<Firm> findByIdForUpdate(@Param("id") UUID id);
}
