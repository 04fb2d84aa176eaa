package org.jellyfinmanager.task.tasks;

import lombok.extern.slf4j.Slf4j;
import org.jellyfinmanager.config.AppProperties;
import org.jellyfinmanager.model.dto.Backup;
import org.jellyfinmanager.model.dto.RestoreResult;
import org.jellyfinmanager.model.enums.TaskType;
import org.jellyfinmanager.service.backup.BackupService;
import org.jellyfinmanager.service.jellyfin.JellyfinClient;
import org.jellyfinmanager.service.restore.RestoreCoordinator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Slf4j
@Component
public class RestoreTask extends AbstractTask {

    private final BackupService backupService;
    private final RestoreCoordinator restoreCoordinator;
    private final JellyfinClient jellyfinClient;

    public RestoreTask(AppProperties appProperties, BackupService backupService,
                       RestoreCoordinator restoreCoordinator, JellyfinClient jellyfinClient) {
        super(appProperties);
        this.backupService = backupService;
        this.restoreCoordinator = restoreCoordinator;
        this.jellyfinClient = jellyfinClient;
    }

    @Override
    protected String run() {
        Backup backup = backupService.readBackup(Path.of(appProperties.getBackupFile()));
        // fail before any restore work when the user cannot be resolved
        jellyfinClient.getUserId();
        log.info("Restoring {} watched items for {} from backup created at {}",
                backup.getWatchedItems().size(), jellyfinClient.getUserName(), backup.getCreatedAt());

        RestoreResult result = restoreCoordinator.restore(backup.getWatchedItems());
        return String.format("Restored %d of %d items (%d failed)", result.successful(), result.total(), result.failed());
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.RESTORE;
    }
}
