package org.jellyfinmanager.model.dto;

import java.util.List;

/**
 * Outcome of a missing episode check across the whole library.
 *
 * @param seriesChecked number of library series looked at
 * @param seriesFailed  series skipped because a catalog fetch failed
 */
public record MissingEpisodeSummary(int seriesChecked, int seriesFailed, List<MissingEpisode> missingEpisodes) {

    public int totalMissing() {
        return missingEpisodes.size();
    }
}
