package org.jellyfinmanager.model.dto.response.jellyfin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public class JellyfinItemsResponse {

    @Builder.Default
    private List<Item> items = new ArrayList<>();
    private Integer totalRecordCount;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class Item {
        private String id;
        private String name;
        private String type;
        private String path;
        private String seriesName;
        private String seasonName;
        private Integer indexNumber;
        private Integer parentIndexNumber;
        private Long runTimeTicks;
        private Map<String, String> providerIds;
        private UserData userData;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class UserData {
        private boolean played;
        private Instant lastPlayedDate;
    }
}
