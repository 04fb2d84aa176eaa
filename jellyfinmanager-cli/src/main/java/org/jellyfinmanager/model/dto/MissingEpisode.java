package org.jellyfinmanager.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class MissingEpisode {
    String seriesName;
    int seasonNumber;
    int episodeNumber;
    String name;
    String airDate;
    String overview;

    public String getCode() {
        return String.format("S%02dE%02d", seasonNumber, episodeNumber);
    }
}
