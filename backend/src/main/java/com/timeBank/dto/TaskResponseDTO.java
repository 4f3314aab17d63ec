package com.timeBank.dto;

import com.timeBank.model.Task;
import com.timeBank.model.ValidationResult;
import com.timeBank.model.enums.TaskStatus;
import com.timeBank.model.enums.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskResponseDTO {
    private String id;
    private String title;
    private String description;
    private int duration;
    private int creditsOffered;
    private TaskType taskType;
    private List<String> skillsRequired;
    private String location;
    private String createdBy;
    private String assignedTo;
    private TaskStatus status;
    private String beforePhoto;
    private String afterPhoto;
    private ValidationResult validationResult;
    private Instant createdAt;
    private Instant completedAt;

    public static TaskResponseDTO fromModel(Task task) {
        if (task == null)
            return null;
        return TaskResponseDTO.builder()
                .id(task.getId())
                .title(task.getTitle())
                .description(task.getDescription())
                .duration(task.getDuration())
                .creditsOffered(task.getCreditsOffered())
                .taskType(task.getTaskType())
                .skillsRequired(task.getSkillsRequired())
                .location(task.getLocation())
                .createdBy(task.getCreatedBy())
                .assignedTo(task.getAssignedTo())
                .status(task.getStatus())
                .beforePhoto(task.getBeforePhoto())
                .afterPhoto(task.getAfterPhoto())
                .validationResult(task.getValidationResult())
                .createdAt(task.getCreatedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }
}
