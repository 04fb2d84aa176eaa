package org.jellyfinmanager.model.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Live movie, series or episode of the Jellyfin library. Season and episode fields are only
 * set for episodes.
 */
@Value
@Builder
public class LibraryItem {
    String id;
    String name;
    boolean played;
    @Singular
    Map<String, String> providerIds;
    String seriesName;
    String seasonName;
    Integer seasonNumber;
    Integer episodeNumber;
    int runtimeMinutes;
}
