package org.jellyfinmanager.task.tasks;

import lombok.extern.slf4j.Slf4j;
import org.jellyfinmanager.config.AppProperties;
import org.jellyfinmanager.exception.ApiError;
import org.jellyfinmanager.model.dto.TaskResult;
import org.jellyfinmanager.model.enums.TaskStatus;

import java.util.UUID;

@Slf4j
abstract class AbstractTask implements Task {

    protected final AppProperties appProperties;

    protected AbstractTask(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Override
    public void validateConfiguration() {
        if (!appProperties.getJellyfin().isConfigured()) {
            throw ApiError.MISSING_CONFIGURATION.createException("Jellyfin server URL, API key and user name");
        }
    }

    @Override
    public TaskResult execute() {
        TaskResult.TaskResultBuilder builder = TaskResult.builder()
                .taskId(UUID.randomUUID().toString())
                .taskType(getTaskType());

        long startTime = System.currentTimeMillis();
        log.debug("{}: Task started", getTaskType());
        try {
            builder.message(run()).status(TaskStatus.COMPLETED);
        } catch (Exception e) {
            log.error("{} failed: {}", getTaskType(), e.getMessage());
            log.debug("{} failure", getTaskType(), e);
            builder.message(e.getMessage()).status(TaskStatus.FAILED);
        }
        long duration = System.currentTimeMillis() - startTime;
        log.debug("{}: Task completed. Duration: {} ms", getTaskType(), duration);
        return builder.durationMs(duration).build();
    }

    /**
     * @return a one line description of the outcome
     */
    protected abstract String run();
}
