package com.timeBank.repository;

import com.timeBank.dto.TaskUpdateDTO;
import com.timeBank.model.Task;
import com.timeBank.model.ValidationResult;
import com.timeBank.model.enums.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for tasks. Implementations wrap data store failures in
 * {@link com.timeBank.exception.ServiceException}.
 */
public interface TaskRepository {

    /** Persists a new task; returns the stored representation. */
    Task insert(Task task);

    Optional<Task> findById(String taskId);

    /** Matching tasks, newest first, at most {@code query.getLimit()}. */
    List<Task> find(TaskQuery query);

    /** Tasks the user created or is assigned to, newest first, no limit. */
    List<Task> findByParticipant(String userId);

    /**
     * Sets the assignee and moves the task to ASSIGNED in one atomic step that only
     * applies while the task is still OPEN.
     *
     * @return the assigned task, or empty if the task was missing or no longer open at write time
     */
    Optional<Task> assignIfOpen(String taskId, String claimantId);

    /**
     * Applies only the non-null fields of {@code update}, in one atomic step that only
     * applies while the task still has the status and assignee the caller checked.
     *
     * @return the updated task, or empty if the task was missing or changed meanwhile
     */
    Optional<Task> updateIfUnchanged(String taskId, TaskStatus expectedStatus, String expectedAssignee,
            TaskUpdateDTO update);

    /**
     * Records a validation outcome, only while the task is still ASSIGNED.
     *
     * @param outcomeStatus VALIDATED or NEEDS_REVIEW
     * @param completedAt stamped for VALIDATED, null otherwise
     * @return the settled task, or empty if the task left ASSIGNED meanwhile
     */
    Optional<Task> settleIfAssigned(String taskId, TaskStatus outcomeStatus,
            ValidationResult result, Instant completedAt);
}
