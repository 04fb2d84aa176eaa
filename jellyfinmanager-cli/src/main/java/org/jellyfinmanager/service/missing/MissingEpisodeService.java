package org.jellyfinmanager.service.missing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jellyfinmanager.exception.APIException;
import org.jellyfinmanager.model.dto.CatalogEpisode;
import org.jellyfinmanager.model.dto.EpisodeKey;
import org.jellyfinmanager.model.dto.LibraryItem;
import org.jellyfinmanager.model.dto.MissingEpisode;
import org.jellyfinmanager.model.dto.MissingEpisodeSummary;
import org.jellyfinmanager.service.event.ReconciliationEventBroadcaster;
import org.jellyfinmanager.service.jellyfin.JellyfinClient;
import org.jellyfinmanager.service.tvdb.TvdbClient;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class MissingEpisodeService {

    static final String TVDB_PROVIDER = "Tvdb";

    private static final Comparator<CatalogEpisode> EPISODE_ORDER = Comparator
            .comparingInt(CatalogEpisode::getSeasonNumber)
            .thenComparingInt(CatalogEpisode::getEpisodeNumber);

    private final JellyfinClient jellyfinClient;
    private final TvdbClient tvdbClient;
    private final MergeDetector mergeDetector;
    private final ReconciliationEventBroadcaster eventBroadcaster;

    /**
     * Checks every library series carrying a TVDB id. A series whose episodes cannot be fetched from
     * either side is reported and skipped; failing to log in to TVDB or to list the library is fatal.
     */
    public MissingEpisodeSummary findMissingEpisodes(boolean includeSpecials) {
        if (!tvdbClient.isAuthenticated()) {
            tvdbClient.login();
        }
        log.info("Fetching all series from Jellyfin...");
        List<LibraryItem> series = jellyfinClient.getAllSeries();
        log.info("Found {} series in Jellyfin, checking for missing episodes", series.size());

        List<MissingEpisode> allMissing = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < series.size(); i++) {
            LibraryItem show = series.get(i);
            String tvdbId = show.getProviderIds().get(TVDB_PROVIDER);
            if (StringUtils.isBlank(tvdbId)) {
                log.debug("Skipping '{}': no TVDB id", show.getName());
                continue;
            }

            List<CatalogEpisode> catalogEpisodes;
            List<LibraryItem> localEpisodes;
            try {
                catalogEpisodes = tvdbClient.getSeriesEpisodes(tvdbId);
            } catch (APIException e) {
                eventBroadcaster.broadcastSeriesSkipped(i + 1, series.size(), show.getName(), "Could not fetch TVDB episodes: " + e.getMessage());
                failed++;
                continue;
            }
            try {
                localEpisodes = jellyfinClient.getEpisodesForSeries(show.getId());
            } catch (APIException e) {
                eventBroadcaster.broadcastSeriesSkipped(i + 1, series.size(), show.getName(), "Could not fetch Jellyfin episodes: " + e.getMessage());
                failed++;
                continue;
            }

            List<MissingEpisode> missing = findMissingForSeries(show.getName(), catalogEpisodes, localEpisodes, includeSpecials);
            if (!missing.isEmpty()) {
                eventBroadcaster.broadcastMissingEpisodes(i + 1, series.size(), show.getName(), tvdbId, missing, catalogEpisodes.size());
                allMissing.addAll(missing);
            }
        }

        MissingEpisodeSummary summary = new MissingEpisodeSummary(series.size(), failed, allMissing);
        eventBroadcaster.broadcastMissingSummary(summary);
        return summary;
    }

    List<MissingEpisode> findMissingForSeries(String seriesName, List<CatalogEpisode> catalogEpisodes,
                                              List<LibraryItem> localEpisodes, boolean includeSpecials) {
        List<CatalogEpisode> ordered = catalogEpisodes.stream().sorted(EPISODE_ORDER).toList();
        return mergeDetector.detectMissing(ordered, localRuntimes(localEpisodes), includeSpecials).stream()
                .map(episode -> episode.toBuilder().seriesName(seriesName).build())
                .toList();
    }

    static Map<EpisodeKey, Integer> localRuntimes(List<LibraryItem> localEpisodes) {
        Map<EpisodeKey, Integer> runtimes = new HashMap<>();
        for (LibraryItem episode : localEpisodes) {
            if (episode.getSeasonNumber() == null || episode.getEpisodeNumber() == null) {
                continue;
            }
            runtimes.put(new EpisodeKey(episode.getSeasonNumber(), episode.getEpisodeNumber()), episode.getRuntimeMinutes());
        }
        return runtimes;
    }
}
