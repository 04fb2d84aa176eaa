package org.jellyfinmanager.service.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.jellyfinmanager.config.AppProperties;
import org.jellyfinmanager.config.JacksonConfig;
import org.jellyfinmanager.exception.ApiError;
import org.jellyfinmanager.model.dto.Backup;
import org.jellyfinmanager.model.dto.WatchedItem;
import org.jellyfinmanager.service.jellyfin.JellyfinClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
public class BackupService {

    private final JellyfinClient jellyfinClient;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public BackupService(JellyfinClient jellyfinClient, AppProperties appProperties,
                         @Qualifier(JacksonConfig.BACKUP_OBJECT_MAPPER) ObjectMapper objectMapper) {
        this.jellyfinClient = jellyfinClient;
        this.appProperties = appProperties;
        this.objectMapper = objectMapper;
    }

    public Backup captureBackup() {
        log.info("Fetching watched items from Jellyfin for user {}...", jellyfinClient.getUserName());
        List<WatchedItem> watchedItems = jellyfinClient.getWatchedItems();
        return Backup.builder()
                .createdAt(Instant.now())
                .serverUrl(jellyfinClient.getServerUrl())
                .userId(jellyfinClient.getUserId())
                .userName(jellyfinClient.getUserName())
                .version(appProperties.getVersion())
                .watchedItems(watchedItems)
                .build();
    }

    public void writeBackup(Backup backup, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), backup);
        } catch (IOException e) {
            throw ApiError.BACKUP_WRITE_FAILED.createException(e, file, e.getMessage());
        }
        log.info("✓ Backed up {} watched items to {}", backup.getWatchedItems().size(), file);
    }

    public Backup readBackup(Path file) {
        if (!Files.isRegularFile(file)) {
            throw ApiError.BACKUP_READ_FAILED.createException(file, "file does not exist");
        }
        try {
            Backup backup = objectMapper.readValue(file.toFile(), Backup.class);
            if (backup.getWatchedItems() == null) {
                backup.setWatchedItems(List.of());
            }
            return backup;
        } catch (IOException e) {
            throw ApiError.BACKUP_READ_FAILED.createException(e, file, e.getMessage());
        }
    }
}
