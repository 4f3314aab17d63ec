package com.timeBank.repository;

import com.timeBank.model.enums.TaskStatus;
import com.timeBank.model.enums.TaskType;
import lombok.Builder;
import lombok.Value;

/** Filters for the public task listing. Null fields do not filter. */
@Value
@Builder
public class TaskQuery {
    TaskStatus status;

    /** Case-insensitive substring of the task location */
    String location;

    TaskType taskType;

    int limit;
}
