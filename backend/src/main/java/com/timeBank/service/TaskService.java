package com.timeBank.service;

import com.timeBank.dto.TaskCreateDTO;
import com.timeBank.dto.TaskUpdateDTO;
import com.timeBank.exception.ErrorCode;
import com.timeBank.exception.ForbiddenException;
import com.timeBank.exception.ResourceNotFoundException;
import com.timeBank.exception.TaskRuleException;
import com.timeBank.model.Task;
import com.timeBank.model.User;
import com.timeBank.model.ValidationResult;
import com.timeBank.model.enums.TaskStatus;
import com.timeBank.model.enums.TaskType;
import com.timeBank.repository.CreditLedger;
import com.timeBank.repository.TaskQuery;
import com.timeBank.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Task lifecycle: open -> assigned -> validated | needs_review.
 * <p>
 * Credits move only in {@link #validateTask}, through the {@link CreditLedger}, and
 * always before the task is written as VALIDATED. A request-type task's balance is
 * checked at creation but not reserved, so the transfer can still be refused later
 * for insufficient credits; the task then stays ASSIGNED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

    public static final int MIN_DURATION_MINUTES = 15;
    public static final int MAX_DURATION_MINUTES = 60;
    public static final int LIST_LIMIT = 100;

    private static final String ALL_TASK_TYPES = "all";

    private final TaskRepository taskRepository;
    private final CreditLedger creditLedger;
    private final EvidenceValidator evidenceValidator;

    public Task createTask(TaskCreateDTO request, User creator) {
        int duration = request.getDuration();
        if (duration < MIN_DURATION_MINUTES || duration > MAX_DURATION_MINUTES) {
            throw new TaskRuleException(ErrorCode.INVALID_DURATION,
                    "Duration must be between " + MIN_DURATION_MINUTES + "-" + MAX_DURATION_MINUTES + " minutes");
        }
        if (request.getTaskType() == TaskType.REQUEST && creator.getTimeCredits() < request.getCreditsOffered()) {
            throw new TaskRuleException(ErrorCode.INSUFFICIENT_CREDITS, "Insufficient time credits");
        }

        Task task = request.toModel(creator.getId());
        task.setId(UUID.randomUUID().toString());
        task.setCreatedAt(Instant.now());

        Task stored = taskRepository.insert(task);
        log.info("Task {} created by {} ({}, {} credits)", stored.getId(), creator.getId(),
                stored.getTaskType().toValue(), stored.getCreditsOffered());
        return stored;
    }

    /**
     * Public listing. A status or task type no task can have matches nothing.
     *
     * @param location case-insensitive substring, ignored when blank
     * @param taskType "offer", "request", or "all"/blank for both
     * @param status exact status, "open" when blank
     */
    public List<Task> listTasks(String location, String taskType, String status) {
        Optional<TaskStatus> statusFilter = TaskStatus.lookup(isBlank(status) ? TaskStatus.OPEN.toValue() : status);
        boolean anyType = isBlank(taskType) || ALL_TASK_TYPES.equals(taskType);
        Optional<TaskType> typeFilter = anyType ? Optional.empty() : TaskType.lookup(taskType);
        if (statusFilter.isEmpty() || (!anyType && typeFilter.isEmpty())) {
            log.debug("Listing with unknown filter status={} task_type={} matches no task", status, taskType);
            return List.of();
        }

        TaskQuery query = TaskQuery.builder()
                .status(statusFilter.get())
                .location(isBlank(location) ? null : location)
                .taskType(typeFilter.orElse(null))
                .limit(LIST_LIMIT)
                .build();
        return taskRepository.find(query);
    }

    public List<Task> listMyTasks(User user) {
        return taskRepository.findByParticipant(user.getId());
    }

    public Task getTask(String taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    }

    /**
     * Claims an open task. The final write only applies while the task is still open,
     * so of two concurrent claims exactly one wins.
     */
    public Task assignTask(String taskId, User claimant) {
        Task task = getTask(taskId);
        if (claimant.getId().equals(task.getCreatedBy())) {
            throw new TaskRuleException(ErrorCode.SELF_ASSIGNMENT, "Cannot assign your own task");
        }
        if (task.getStatus() != TaskStatus.OPEN) {
            throw new TaskRuleException(ErrorCode.NOT_AVAILABLE, "Task is not available");
        }

        Task assigned = taskRepository.assignIfOpen(taskId, claimant.getId())
                .orElseThrow(() -> new TaskRuleException(ErrorCode.NOT_AVAILABLE, "Task is not available"));
        log.info("Task {} assigned to {}", taskId, claimant.getId());
        return assigned;
    }

    /**
     * Partial update by the creator or the assignee. VALIDATED can only be reached
     * through {@link #validateTask}. A task carries an assignee exactly when its
     * status is past OPEN, and both are frozen once the task is VALIDATED or NEEDS_REVIEW.
     */
    public Task updateTask(String taskId, TaskUpdateDTO update, User actor) {
        if (update == null || update.isEmpty()) {
            throw new TaskRuleException(ErrorCode.NO_FIELDS, "No update data provided");
        }

        Task task = getTask(taskId);
        if (!task.isParticipant(actor.getId())) {
            throw new ForbiddenException("Not authorized to update this task");
        }
        if (update.getStatus() == TaskStatus.VALIDATED) {
            throw new TaskRuleException(ErrorCode.WRONG_STATUS, "Tasks become validated only through validation");
        }
        if (update.getAssignedTo() != null && update.getAssignedTo().equals(task.getCreatedBy())) {
            throw new TaskRuleException(ErrorCode.SELF_ASSIGNMENT, "Cannot assign your own task");
        }
        checkTransition(task, update);

        Task updated = taskRepository.updateIfUnchanged(taskId, task.getStatus(), task.getAssignedTo(), update)
                .orElseThrow(() -> new TaskRuleException(ErrorCode.WRONG_STATUS,
                        "Task changed while it was being updated"));
        if (updated.getStatus() != task.getStatus()) {
            log.info("Task {} moved from {} to {} by {}", taskId, task.getStatus().toValue(),
                    updated.getStatus().toValue(), actor.getId());
        }
        return updated;
    }

    private static void checkTransition(Task task, TaskUpdateDTO update) {
        boolean changesStatus = update.getStatus() != null && update.getStatus() != task.getStatus();
        boolean changesAssignee = update.getAssignedTo() != null && !update.getAssignedTo().equals(task.getAssignedTo());
        if (task.getStatus().isTerminal() && (changesStatus || changesAssignee)) {
            throw new TaskRuleException(ErrorCode.WRONG_STATUS,
                    "Task is already " + task.getStatus().toValue() + " and can no longer change");
        }

        TaskStatus nextStatus = update.getStatus() != null ? update.getStatus() : task.getStatus();
        String nextAssignee = update.getAssignedTo() != null ? update.getAssignedTo() : task.getAssignedTo();
        if (!nextStatus.allowsAssignee() && nextAssignee != null) {
            throw new TaskRuleException(ErrorCode.WRONG_STATUS,
                    "A task with status '" + nextStatus.toValue() + "' cannot have an assignee");
        }
        if (nextStatus.allowsAssignee() && nextAssignee == null) {
            throw new TaskRuleException(ErrorCode.WRONG_STATUS,
                    "A task with status '" + nextStatus.toValue() + "' needs an assignee");
        }
    }

    /**
     * Checks the evidence of an assigned task and settles it. A valid outcome
     * transfers {@code credits_offered} from creator to assignee first, then marks the
     * task VALIDATED; if the transfer fails the task is left untouched. An invalid
     * outcome marks the task NEEDS_REVIEW without any transfer.
     */
    public ValidationResult validateTask(String taskId, User actor) {
        Task task = getTask(taskId);
        if (!task.hasEvidence()) {
            throw new TaskRuleException(ErrorCode.MISSING_EVIDENCE,
                    "Both before and after photos are required for validation.");
        }
        if (task.getStatus() != TaskStatus.ASSIGNED) {
            throw new TaskRuleException(ErrorCode.WRONG_STATUS,
                    "Task cannot be validated with status '" + task.getStatus().toValue() + "'.");
        }
        if (task.getAssignedTo() == null) {
            throw new TaskRuleException(ErrorCode.WRONG_STATUS, "Task has no assignee to credit");
        }

        ValidationResult result = evidenceValidator.validate(task);
        log.info("Validation of task {} requested by {}: valid={}, confidence={}",
                taskId, actor.getId(), result.isValid(), result.getConfidence());

        TaskStatus outcome;
        Instant completedAt = null;
        if (result.isValid()) {
            creditLedger.transfer(task.getId(), task.getCreatedBy(), task.getAssignedTo(), task.getCreditsOffered());
            outcome = TaskStatus.VALIDATED;
            completedAt = Instant.now();
        } else {
            outcome = TaskStatus.NEEDS_REVIEW;
        }

        if (taskRepository.settleIfAssigned(taskId, outcome, result, completedAt).isEmpty()) {
            log.warn("Task {} left ASSIGNED before its {} outcome was recorded", taskId, outcome.toValue());
            throw new TaskRuleException(ErrorCode.WRONG_STATUS, "Task is no longer assigned");
        }
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
