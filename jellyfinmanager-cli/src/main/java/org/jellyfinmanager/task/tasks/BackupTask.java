package org.jellyfinmanager.task.tasks;

import org.jellyfinmanager.config.AppProperties;
import org.jellyfinmanager.model.dto.Backup;
import org.jellyfinmanager.model.enums.TaskType;
import org.jellyfinmanager.service.backup.BackupService;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class BackupTask extends AbstractTask {

    private final BackupService backupService;

    public BackupTask(AppProperties appProperties, BackupService backupService) {
        super(appProperties);
        this.backupService = backupService;
    }

    @Override
    protected String run() {
        Backup backup = backupService.captureBackup();
        backupService.writeBackup(backup, Path.of(appProperties.getBackupFile()));
        return "Backed up " + backup.getWatchedItems().size() + " watched items";
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.BACKUP;
    }
}
