package com.timeBank.mapper;

import com.timeBank.dto.TaskUpdateDTO;
import com.timeBank.model.Task;
import com.timeBank.model.ValidationResult;
import com.timeBank.model.enums.TaskStatus;
import com.timeBank.model.enums.TaskType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates between {@link Task} and the field map stored in the "tasks" collection.
 * Every task read, single or multi row, goes through {@link #decode(String, Map)}.
 */
public final class TaskDocumentMapper {

    public static final String ID = "id";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String DURATION = "duration";
    public static final String CREDITS_OFFERED = "credits_offered";
    public static final String TASK_TYPE = "task_type";
    public static final String SKILLS_REQUIRED = "skills_required";
    public static final String LOCATION = "location";
    public static final String CREATED_BY = "created_by";
    public static final String ASSIGNED_TO = "assigned_to";
    public static final String STATUS = "status";
    public static final String BEFORE_PHOTO = "before_photo";
    public static final String AFTER_PHOTO = "after_photo";
    public static final String VALIDATION_RESULT = "validation_result";
    public static final String CREATED_AT = "created_at";
    public static final String COMPLETED_AT = "completed_at";

    private TaskDocumentMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * @param documentId Firestore document id, used when the row carries no "id" field
     * @param data raw document fields
     * @return decoded task, or null for a missing document
     */
    public static Task decode(String documentId, Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        String id = DocumentValues.getString(data, ID);
        return Task.builder()
                .id(id != null ? id : documentId)
                .title(DocumentValues.getString(data, TITLE))
                .description(DocumentValues.getString(data, DESCRIPTION))
                .duration(DocumentValues.getInt(data, DURATION, 0))
                .creditsOffered(DocumentValues.getInt(data, CREDITS_OFFERED, 0))
                .taskType(TaskType.fromValue(DocumentValues.getString(data, TASK_TYPE)))
                .skillsRequired(TextArrayParser.decode(data.get(SKILLS_REQUIRED)))
                .location(DocumentValues.getString(data, LOCATION))
                .createdBy(DocumentValues.getString(data, CREATED_BY))
                .assignedTo(DocumentValues.getString(data, ASSIGNED_TO))
                .status(decodeStatus(DocumentValues.getString(data, STATUS)))
                .beforePhoto(DocumentValues.getString(data, BEFORE_PHOTO))
                .afterPhoto(DocumentValues.getString(data, AFTER_PHOTO))
                .validationResult(decodeValidationResult(data.get(VALIDATION_RESULT)))
                .createdAt(DocumentValues.getInstant(data, CREATED_AT))
                .completedAt(DocumentValues.getInstant(data, COMPLETED_AT))
                .build();
    }

    /** Full document for a newly created task. */
    public static Map<String, Object> encode(Task task) {
        Map<String, Object> data = new HashMap<>();
        data.put(ID, task.getId());
        data.put(TITLE, task.getTitle());
        data.put(DESCRIPTION, task.getDescription());
        data.put(DURATION, task.getDuration());
        data.put(CREDITS_OFFERED, task.getCreditsOffered());
        data.put(TASK_TYPE, task.getTaskType() == null ? null : task.getTaskType().toValue());
        data.put(SKILLS_REQUIRED, task.getSkillsRequired() == null
                ? new ArrayList<>()
                : new ArrayList<>(task.getSkillsRequired()));
        data.put(LOCATION, task.getLocation());
        data.put(CREATED_BY, task.getCreatedBy());
        data.put(ASSIGNED_TO, task.getAssignedTo());
        data.put(STATUS, task.getStatus().toValue());
        data.put(BEFORE_PHOTO, task.getBeforePhoto());
        data.put(AFTER_PHOTO, task.getAfterPhoto());
        data.put(VALIDATION_RESULT, encodeValidationResult(task.getValidationResult()));
        data.put(CREATED_AT, DocumentValues.toTimestamp(task.getCreatedAt()));
        data.put(COMPLETED_AT, DocumentValues.toTimestamp(task.getCompletedAt()));
        return data;
    }

    /** Only the fields present in the update; absent fields stay untouched in storage. */
    public static Map<String, Object> encode(TaskUpdateDTO update) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (update.getStatus() != null)
            data.put(STATUS, update.getStatus().toValue());
        if (update.getAssignedTo() != null)
            data.put(ASSIGNED_TO, update.getAssignedTo());
        if (update.getBeforePhoto() != null)
            data.put(BEFORE_PHOTO, update.getBeforePhoto());
        if (update.getAfterPhoto() != null)
            data.put(AFTER_PHOTO, update.getAfterPhoto());
        return data;
    }

    /** Fields written when a task is settled by validation. */
    public static Map<String, Object> encodeOutcome(Task settled) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(STATUS, settled.getStatus().toValue());
        data.put(VALIDATION_RESULT, encodeValidationResult(settled.getValidationResult()));
        if (settled.getCompletedAt() != null)
            data.put(COMPLETED_AT, DocumentValues.toTimestamp(settled.getCompletedAt()));
        return data;
    }

    public static Map<String, Object> encodeValidationResult(ValidationResult result) {
        if (result == null) {
            return null;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("valid", result.isValid());
        data.put("confidence", result.getConfidence());
        data.put("reason", result.getReason());
        return data;
    }

    private static TaskStatus decodeStatus(String value) {
        return value == null ? TaskStatus.OPEN : TaskStatus.fromValue(value);
    }

    @SuppressWarnings("unchecked")
    private static ValidationResult decodeValidationResult(Object raw) {
        if (!(raw instanceof Map)) {
            return null;
        }
        Map<String, Object> data = (Map<String, Object>) raw;
        return ValidationResult.builder()
                .valid(DocumentValues.getBoolean(data, "valid"))
                .confidence(DocumentValues.getInt(data, "confidence", 0))
                .reason(DocumentValues.getString(data, "reason"))
                .build();
    }
}
