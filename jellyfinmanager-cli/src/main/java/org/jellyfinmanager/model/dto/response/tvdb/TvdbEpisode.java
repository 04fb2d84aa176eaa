package org.jellyfinmanager.model.dto.response.tvdb;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TvdbEpisode {
    private Integer id;
    private Integer seriesId;
    private String name;
    private String overview;
    private String aired;
    private Integer seasonNumber;
    private Integer number;
    private Integer absoluteNumber;
    @JsonProperty("runtime")
    private Integer runtimeMinutes;
    private String finaleType;
}
