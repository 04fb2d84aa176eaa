package org.jellyfinmanager.model.dto;

import lombok.Builder;
import lombok.Data;
import org.jellyfinmanager.model.enums.TaskStatus;
import org.jellyfinmanager.model.enums.TaskType;

@Data
@Builder
public class TaskResult {
    private String taskId;
    private TaskType taskType;
    private TaskStatus status;
    private String message;
    private long durationMs;
}
