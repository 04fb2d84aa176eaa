package org.jellyfinmanager.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.jellyfinmanager.model.enums.ItemType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A watched movie or episode as captured in a backup. Provider ids keep the order they were listed in,
 * which is the order they are tried in during restore.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WatchedItem {
    private String id;
    private String name;
    private ItemType type;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String seriesName;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String seasonName;
    private Instant playedDate;
    @Builder.Default
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, String> providerIds = new LinkedHashMap<>();
}
