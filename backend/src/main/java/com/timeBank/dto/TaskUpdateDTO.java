package com.timeBank.dto;

import com.timeBank.model.enums.TaskStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of PUT /api/tasks/{id}. Every field is optional; null leaves the stored value unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskUpdateDTO {
    private TaskStatus status;
    private String assignedTo;
    private String beforePhoto;
    private String afterPhoto;

    @JsonIgnore
    public boolean isEmpty() {
        return status == null && assignedTo == null && beforePhoto == null && afterPhoto == null;
    }
}
