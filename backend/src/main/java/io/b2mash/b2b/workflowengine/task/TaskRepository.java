package io.b2mash.b2b.workflowengine.task;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Task t WHERE t.id = :id")
  Optional<Task> findByIdForUpdate(@Param("id") UUID id);

  @Query("SELECT t FROM Task t WHERE t.projectId = :projectId ORDER BY t.createdAt ASC")
  List<Task> findByProjectId(@Param("projectId") UUID projectId);

  /**
   * Template-originated, non-instance tasks of a project, locked in id order. These are the tasks
   * the stage cascade is allowed to move.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      """
      SELECT t FROM Task t
      WHERE t.projectId = :projectId
        AND t.templateTaskOriginId IS NOT NULL
        AND t.masterTaskId IS NULL
      ORDER BY t.id
      """)
  List<Task> findCascadeCandidatesForUpdate(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT t FROM Task t
      WHERE t.projectId = :projectId
        AND t.templateTaskOriginId IS NOT NULL
        AND t.masterTaskId IS NULL
      """)
  List<Task> findCascadeCandidates(@Param("projectId") UUID projectId);

  Optional<Task> findByMasterTaskIdAndDueDate(UUID masterTaskId, LocalDate dueDate);

  /** Project tasks sharing a template origin and due date, other than the given task. */
  @Query(
      """
      SELECT t FROM Task t
      WHERE t.projectId = :projectId
        AND t.templateTaskOriginId = :originId
        AND t.dueDate = :dueDate
        AND t.id <> :excludedId
      ORDER BY t.createdAt ASC
      """)
  List<Task> findSameOriginOnDate(
      @Param("projectId") UUID projectId,
      @Param("originId") UUID originId,
      @Param("dueDate") LocalDate dueDate,
      @Param("excludedId") UUID excludedId);

  @Query("SELECT t.projectId FROM Task t WHERE t.id = :id")
  Optional<UUID> findProjectIdById(@Param("id") UUID id);

  List<Task> findByMasterTaskIdOrderByDueDateAsc(UUID masterTaskId);

  Optional<Task> findFirstByMasterTaskIdOrderByDueDateDesc(UUID masterTaskId);

  /**
   * Recurring masters of a firm whose next occurrence is due. Masters whose occurrence already
   * exists are included; generation is idempotent and returns the existing row for them.
   */
  @Query(
      """
      SELECT m FROM Task m
      WHERE m.firmId = :firmId
        AND m.recurring = true
        AND m.masterTaskId IS NULL
        AND m.nextDueDate IS NOT NULL
        AND m.nextDueDate <= :asOf
      ORDER BY m.nextDueDate ASC, m.id ASC
      """)
  List<Task> findDueRecurringMasters(
      @Param("firmId") UUID firmId, @Param("asOf") LocalDate asOf);

  @Query("SELECT t FROM Task t WHERE t.id IN :ids AND t.completedAt IS NULL ORDER BY t.id")
  List<Task> findIncompleteByIdIn(@Param("ids") Collection<UUID> ids);

  boolean existsByStatusIdIn(Collection<UUID> statusIds);

  long countByProjectId(UUID projectId);
}
