package org.jellyfinmanager.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Backup {
    private Instant createdAt;
    private String serverUrl;
    private String userId;
    private String userName;
    private String version;
    @Builder.Default
    private List<WatchedItem> watchedItems = new ArrayList<>();
}
