package com.timeBank.dto;

import com.timeBank.model.Task;
import com.timeBank.model.enums.TaskStatus;
import com.timeBank.model.enums.TaskType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of POST /api/tasks. The 15..60 minute duration window is enforced by
 * TaskService, not here, so it reports as INVALID_DURATION.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskCreateDTO {
    @NotBlank(message = "Title is required")
    private String title;

    @NotNull(message = "Description is required")
    private String description;

    @NotNull(message = "Duration is required")
    private Integer duration;

    @NotNull(message = "Credits offered is required")
    @Min(value = 0, message = "Credits offered must be >= 0")
    private Integer creditsOffered;

    @NotNull(message = "Task type is required")
    private TaskType taskType;

    @Builder.Default
    private List<String> skillsRequired = new ArrayList<>();

    @NotNull(message = "Location is required")
    private String location;

    public Task toModel(String creatorId) {
        return Task.builder()
                .title(this.title)
                .description(this.description)
                .duration(this.duration)
                .creditsOffered(this.creditsOffered)
                .taskType(this.taskType)
                .skillsRequired(this.skillsRequired == null ? new ArrayList<>() : new ArrayList<>(this.skillsRequired))
                .location(this.location)
                .createdBy(creatorId)
                .status(TaskStatus.OPEN)
                .build();
    }
}
