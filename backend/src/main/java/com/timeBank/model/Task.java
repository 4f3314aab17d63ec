package com.timeBank.model;

import com.timeBank.model.enums.TaskStatus;
import com.timeBank.model.enums.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Task {
    private String id;
    private String title;
    private String description;

    /** Minutes, 15..60 at creation */
    private int duration;

    private int creditsOffered;
    private TaskType taskType;

    @Builder.Default
    private List<String> skillsRequired = new ArrayList<>();

    private String location;
    private String createdBy;
    private String assignedTo;

    @Builder.Default
    private TaskStatus status = TaskStatus.OPEN;

    private String beforePhoto;
    private String afterPhoto;
    private ValidationResult validationResult;
    private Instant createdAt;
    private Instant completedAt;

    public boolean hasEvidence() {
        return beforePhoto != null && !beforePhoto.isEmpty()
                && afterPhoto != null && !afterPhoto.isEmpty();
    }

    public boolean isParticipant(String userId) {
        return userId != null && (userId.equals(createdBy) || userId.equals(assignedTo));
    }
}
