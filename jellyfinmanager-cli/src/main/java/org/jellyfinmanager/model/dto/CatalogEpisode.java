package org.jellyfinmanager.model.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Episode as listed by the authoritative remote catalog. {@code airDate} is the raw
 * {@code yyyy-MM-dd} string and may be blank or malformed.
 */
@Value
@Builder
public class CatalogEpisode {
    Integer seriesId;
    int seasonNumber;
    int episodeNumber;
    String name;
    String overview;
    String airDate;
    int runtimeMinutes;

    public EpisodeKey getKey() {
        return new EpisodeKey(seasonNumber, episodeNumber);
    }
}
