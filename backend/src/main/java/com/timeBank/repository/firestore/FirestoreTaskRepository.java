package com.timeBank.repository.firestore;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.timeBank.dto.TaskUpdateDTO;
import com.timeBank.mapper.TaskDocumentMapper;
import com.timeBank.model.Task;
import com.timeBank.model.ValidationResult;
import com.timeBank.model.enums.TaskStatus;
import com.timeBank.repository.TaskQuery;
import com.timeBank.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Tasks in the "tasks" collection, keyed by task id.
 * <p>
 * The status + created_at listing needs a composite index in Firestore
 * (status ASC, task_type ASC, created_at DESC).
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FirestoreTaskRepository implements TaskRepository {

    static final String COLLECTION_NAME = "tasks";

    private final Firestore firestore;

    @Override
    public Task insert(Task task) {
        try {
            tasks().document(task.getId())
                    .create(TaskDocumentMapper.encode(task)).get();
            return task;
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot create task", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot create task");
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        try {
            DocumentSnapshot doc = tasks().document(taskId).get().get();
            if (!doc.exists()) {
                return Optional.empty();
            }
            return Optional.of(TaskDocumentMapper.decode(doc.getId(), doc.getData()));
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot get task", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot get task: " + taskId);
        }
    }

    @Override
    public List<Task> find(TaskQuery query) {
        Query firestoreQuery = tasks();
        if (query.getStatus() != null) {
            firestoreQuery = firestoreQuery.whereEqualTo(TaskDocumentMapper.STATUS, query.getStatus().toValue());
        }
        if (query.getTaskType() != null) {
            firestoreQuery = firestoreQuery.whereEqualTo(TaskDocumentMapper.TASK_TYPE, query.getTaskType().toValue());
        }
        firestoreQuery = firestoreQuery.orderBy(TaskDocumentMapper.CREATED_AT, Query.Direction.DESCENDING);

        // Firestore has no substring match, so the location filter runs here and the
        // limit can only be pushed down when there is no location filter.
        String location = query.getLocation() == null ? null : query.getLocation().toLowerCase(Locale.ROOT);
        if (location == null) {
            firestoreQuery = firestoreQuery.limit(query.getLimit());
        }

        try {
            List<Task> result = new ArrayList<>();
            for (QueryDocumentSnapshot doc : firestoreQuery.get().get().getDocuments()) {
                Task task = TaskDocumentMapper.decode(doc.getId(), doc.getData());
                if (location != null && (task.getLocation() == null
                        || !task.getLocation().toLowerCase(Locale.ROOT).contains(location))) {
                    continue;
                }
                result.add(task);
                if (result.size() >= query.getLimit()) {
                    break;
                }
            }
            return result;
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot get list of tasks", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot get list of tasks");
        }
    }

    @Override
    public List<Task> findByParticipant(String userId) {
        try {
            // Two equality queries instead of an OR query: no composite index needed
            Map<String, Task> byId = new LinkedHashMap<>();
            for (String field : List.of(TaskDocumentMapper.CREATED_BY, TaskDocumentMapper.ASSIGNED_TO)) {
                for (QueryDocumentSnapshot doc : tasks().whereEqualTo(field, userId).get().get().getDocuments()) {
                    byId.putIfAbsent(doc.getId(), TaskDocumentMapper.decode(doc.getId(), doc.getData()));
                }
            }
            List<Task> result = new ArrayList<>(byId.values());
            result.sort(Comparator.comparing(Task::getCreatedAt,
                    Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed());
            return result;
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot get tasks of user", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot get tasks of user: " + userId);
        }
    }

    @Override
    public Optional<Task> assignIfOpen(String taskId, String claimantId) {
        DocumentReference docRef = tasks().document(taskId);
        try {
            Task assigned = firestore.runTransaction(transaction -> {
                DocumentSnapshot doc = transaction.get(docRef).get();
                if (!doc.exists()) {
                    return null;
                }
                Task current = TaskDocumentMapper.decode(doc.getId(), doc.getData());
                if (current.getStatus() != TaskStatus.OPEN) {
                    return null;
                }
                Map<String, Object> fields = Map.of(
                        TaskDocumentMapper.ASSIGNED_TO, claimantId,
                        TaskDocumentMapper.STATUS, TaskStatus.ASSIGNED.toValue());
                transaction.update(docRef, fields);
                return current.toBuilder()
                        .assignedTo(claimantId)
                        .status(TaskStatus.ASSIGNED)
                        .build();
            }).get();
            return Optional.ofNullable(assigned);
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot assign task", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot assign task: " + taskId);
        }
    }

    @Override
    public Optional<Task> updateIfUnchanged(String taskId, TaskStatus expectedStatus, String expectedAssignee,
            TaskUpdateDTO update) {
        Map<String, Object> fields = TaskDocumentMapper.encode(update);
        DocumentReference docRef = tasks().document(taskId);
        try {
            Task updated = firestore.runTransaction(transaction -> {
                DocumentSnapshot doc = transaction.get(docRef).get();
                if (!doc.exists()) {
                    return null;
                }
                Task current = TaskDocumentMapper.decode(doc.getId(), doc.getData());
                if (current.getStatus() != expectedStatus
                        || !Objects.equals(current.getAssignedTo(), expectedAssignee)) {
                    return null;
                }
                transaction.update(docRef, fields);
                Map<String, Object> merged = new HashMap<>(doc.getData());
                merged.putAll(fields);
                return TaskDocumentMapper.decode(doc.getId(), merged);
            }).get();
            return Optional.ofNullable(updated);
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot update task", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot update task: " + taskId);
        }
    }

    @Override
    public Optional<Task> settleIfAssigned(String taskId, TaskStatus outcomeStatus,
            ValidationResult result, Instant completedAt) {
        DocumentReference docRef = tasks().document(taskId);
        try {
            Task settled = firestore.runTransaction(transaction -> {
                DocumentSnapshot doc = transaction.get(docRef).get();
                if (!doc.exists()) {
                    return null;
                }
                Task current = TaskDocumentMapper.decode(doc.getId(), doc.getData());
                if (current.getStatus() != TaskStatus.ASSIGNED) {
                    return null;
                }
                Task next = current.toBuilder()
                        .status(outcomeStatus)
                        .validationResult(result)
                        .completedAt(completedAt)
                        .build();
                transaction.update(docRef, TaskDocumentMapper.encodeOutcome(next));
                return next;
            }).get();
            if (settled != null) {
                log.info("Task {} settled as {}", taskId, outcomeStatus.toValue());
            }
            return Optional.ofNullable(settled);
        } catch (InterruptedException e) {
            throw FirestoreErrors.interrupted("Cannot record validation", e);
        } catch (ExecutionException e) {
            throw FirestoreErrors.unwrap(e, "Cannot record validation for task: " + taskId);
        }
    }

    private CollectionReference tasks() {
        return firestore.collection(COLLECTION_NAME);
    }
}
