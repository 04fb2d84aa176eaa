package org.jellyfinmanager.task.tasks;

import org.jellyfinmanager.model.dto.TaskResult;
import org.jellyfinmanager.model.enums.TaskType;

public interface Task {

    TaskResult execute();

    TaskType getTaskType();

    /**
     * Fails with an {@code APIException} when configuration the task needs is missing.
     */
    void validateConfiguration();
}
