package org.jellyfinmanager.model.dto;

import java.util.List;

/**
 * Watched episodes of one series, split by season name.
 */
public record SeriesGroup(String seriesName, List<SeasonGroup> seasons) {

    public record SeasonGroup(String seasonName, List<WatchedItem> episodes) {
    }

    public int episodeCount() {
        return seasons.stream().mapToInt(season -> season.episodes().size()).sum();
    }
}
