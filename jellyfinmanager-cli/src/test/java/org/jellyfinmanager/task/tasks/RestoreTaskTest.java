package org.jellyfinmanager.task.tasks;

import org.jellyfinmanager.config.AppProperties;
import org.jellyfinmanager.exception.ApiError;
import org.jellyfinmanager.model.dto.Backup;
import org.jellyfinmanager.model.dto.RestoreResult;
import org.jellyfinmanager.model.dto.TaskResult;
import org.jellyfinmanager.model.dto.WatchedItem;
import org.jellyfinmanager.model.enums.ItemType;
import org.jellyfinmanager.model.enums.TaskStatus;
import org.jellyfinmanager.service.backup.BackupService;
import org.jellyfinmanager.service.jellyfin.JellyfinClient;
import org.jellyfinmanager.service.restore.RestoreCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RestoreTaskTest {

    @Mock
    private BackupService backupService;
    @Mock
    private RestoreCoordinator restoreCoordinator;
    @Mock
    private JellyfinClient jellyfinClient;

    private RestoreTask restoreTask;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.setBackupFile("backups/watched.json");
        restoreTask = new RestoreTask(appProperties, backupService, restoreCoordinator, jellyfinClient);
    }

    @Test
    void execute_shouldRestoreItemsFromConfiguredFile() {
        List<WatchedItem> items = List.of(WatchedItem.builder().name("Heat").type(ItemType.MOVIE).build());
        when(backupService.readBackup(Path.of("backups/watched.json"))).thenReturn(Backup.builder().watchedItems(items).build());
        when(restoreCoordinator.restore(items)).thenReturn(new RestoreResult(1, 0));

        TaskResult result = restoreTask.execute();

        assertEquals(TaskStatus.COMPLETED, result.getStatus());
        assertEquals("Restored 1 of 1 items (0 failed)", result.getMessage());
        verify(jellyfinClient).getUserId();
    }

    @Test
    void execute_shouldFailBeforeRestoring_whenUserIsUnknown() {
        when(backupService.readBackup(any())).thenReturn(Backup.builder().watchedItems(List.of()).build());
        when(jellyfinClient.getUserId()).thenThrow(ApiError.JELLYFIN_USER_NOT_FOUND.createException("alice"));

        TaskResult result = restoreTask.execute();

        assertEquals(TaskStatus.FAILED, result.getStatus());
        verifyNoInteractions(restoreCoordinator);
    }

    @Test
    void execute_shouldFail_whenBackupCannotBeRead() {
        when(backupService.readBackup(any())).thenThrow(ApiError.BACKUP_READ_FAILED.createException("x", "file does not exist"));

        TaskResult result = restoreTask.execute();

        assertEquals(TaskStatus.FAILED, result.getStatus());
        verifyNoInteractions(jellyfinClient, restoreCoordinator);
    }
}
