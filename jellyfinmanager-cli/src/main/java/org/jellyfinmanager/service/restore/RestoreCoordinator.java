package org.jellyfinmanager.service.restore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jellyfinmanager.model.dto.LibraryItem;
import org.jellyfinmanager.model.dto.RestoreResult;
import org.jellyfinmanager.model.dto.SeriesGroup;
import org.jellyfinmanager.model.dto.WatchedItem;
import org.jellyfinmanager.model.enums.ItemType;
import org.jellyfinmanager.service.event.ReconciliationEventBroadcaster;
import org.jellyfinmanager.service.jellyfin.JellyfinClient;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Re-applies the watched state of backup records to the live library. Items are processed one at a
 * time; a failure on one item or series is counted and never stops the rest of the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestoreCoordinator {

    @FunctionalInterface
    public interface SeriesLookup {
        String findSeriesId(String seriesName);
    }

    @FunctionalInterface
    public interface EpisodeFetcher {
        List<LibraryItem> fetchEpisodes(String seriesId);
    }

    private final JellyfinClient jellyfinClient;
    private final IdentityResolver identityResolver;
    private final ReconciliationEventBroadcaster eventBroadcaster;

    /**
     * Restores a whole backup: movies first, then episodes grouped by series and season.
     */
    public RestoreResult restore(List<WatchedItem> watchedItems) {
        List<WatchedItem> movies = new ArrayList<>();
        List<WatchedItem> episodes = new ArrayList<>();
        for (WatchedItem item : watchedItems) {
            ItemType type = item.getType() != null ? item.getType() : ItemType.UNKNOWN;
            switch (type) {
                case MOVIE -> movies.add(item);
                case EPISODE -> episodes.add(item);
                default -> log.warn("Skipping '{}': neither a movie nor an episode", item.getName());
            }
        }
        List<SeriesGroup> groups = groupEpisodes(episodes);
        log.info("Found {} movies and {} TV shows", movies.size(), groups.size());

        RestoreResult result = RestoreResult.EMPTY;
        if (!movies.isEmpty()) {
            log.info("=== Processing {} Movies ===", movies.size());
            result = result.plus(restoreMovies(movies));
        }
        if (!groups.isEmpty()) {
            log.info("=== Processing {} TV Shows ===", groups.size());
            result = result.plus(restoreEpisodes(groups, jellyfinClient::findSeriesId, jellyfinClient::getEpisodesForSeries));
        }

        eventBroadcaster.broadcastRestoreSummary(result, movies.size() + episodes.size());
        return result;
    }

    private RestoreResult restoreMovies(List<WatchedItem> watchedMovies) {
        List<LibraryItem> targetMovies;
        try {
            targetMovies = jellyfinClient.getAllMovies();
        } catch (RuntimeException e) {
            log.error("Error fetching movies from server: {}", e.getMessage());
            return RestoreResult.failedAll(watchedMovies.size());
        }
        return restoreMovies(watchedMovies, targetMovies);
    }

    public RestoreResult restoreMovies(List<WatchedItem> watchedMovies, List<LibraryItem> targetMovies) {
        IdentityIndex index = buildIndex(targetMovies, SecondaryKey.NAME);

        int successful = 0;
        int failed = 0;
        for (int i = 0; i < watchedMovies.size(); i++) {
            WatchedItem movie = watchedMovies.get(i);
            log.info("[{}/{}] Processing movie: {}", i + 1, watchedMovies.size(), movie.getName());
            if (apply(movie, identityResolver.resolve(movie, index))) {
                successful++;
            } else {
                failed++;
            }
        }
        return new RestoreResult(successful, failed);
    }

    public RestoreResult restoreEpisodes(List<SeriesGroup> groups, SeriesLookup seriesLookup, EpisodeFetcher episodeFetcher) {
        RestoreResult result = RestoreResult.EMPTY;
        for (int i = 0; i < groups.size(); i++) {
            SeriesGroup group = groups.get(i);
            log.info("[{}/{}] Processing show: {} ({} episodes)", i + 1, groups.size(), group.seriesName(), group.episodeCount());
            result = result.plus(restoreSeries(group, seriesLookup, episodeFetcher));
        }
        return result;
    }

    private RestoreResult restoreSeries(SeriesGroup group, SeriesLookup seriesLookup, EpisodeFetcher episodeFetcher) {
        List<LibraryItem> liveEpisodes;
        try {
            String seriesId = seriesLookup.findSeriesId(group.seriesName());
            liveEpisodes = episodeFetcher.fetchEpisodes(seriesId);
        } catch (RuntimeException e) {
            eventBroadcaster.broadcastSeriesFailed(group.seriesName(), group.episodeCount(), e);
            return RestoreResult.failedAll(group.episodeCount());
        }

        IdentityIndex index = buildIndex(liveEpisodes, SecondaryKey.SEASON_AND_NAME);
        int successful = 0;
        int failed = 0;
        for (SeriesGroup.SeasonGroup season : group.seasons()) {
            log.info("  Season: {} ({} episodes)", season.seasonName(), season.episodes().size());
            for (WatchedItem episode : season.episodes()) {
                if (apply(episode, identityResolver.resolve(episode, index))) {
                    successful++;
                } else {
                    failed++;
                }
            }
        }
        return new RestoreResult(successful, failed);
    }

    private boolean apply(WatchedItem watched, Optional<LibraryItem> match) {
        if (match.isEmpty()) {
            eventBroadcaster.broadcastItemNotFound(watched);
            return false;
        }
        LibraryItem target = match.get();
        if (target.isPlayed()) {
            eventBroadcaster.broadcastItemAlreadyWatched(watched, target);
            return true;
        }
        try {
            jellyfinClient.markAsWatched(target.getId());
        } catch (RuntimeException e) {
            eventBroadcaster.broadcastMarkFailed(watched, target, e);
            return false;
        }
        eventBroadcaster.broadcastItemMarked(watched, target);
        return true;
    }

    private IdentityIndex buildIndex(List<LibraryItem> items, SecondaryKey secondaryKey) {
        IdentityIndex index = identityResolver.build(items, secondaryKey);
        index.getCollisions().forEach(collision ->
                eventBroadcaster.broadcastIdentityCollision(collision.key(), collision.previous(), collision.replacement()));
        return index;
    }

    /**
     * Groups episodes by series name, then season name. Series and seasons are sorted by name; episodes
     * keep their backup order within a season.
     */
    public static List<SeriesGroup> groupEpisodes(List<WatchedItem> episodes) {
        Map<String, Map<String, List<WatchedItem>>> bySeries = new TreeMap<>();
        for (WatchedItem episode : episodes) {
            bySeries.computeIfAbsent(StringUtils.defaultString(episode.getSeriesName()), k -> new TreeMap<>())
                    .computeIfAbsent(StringUtils.defaultString(episode.getSeasonName()), k -> new ArrayList<>())
                    .add(episode);
        }
        return bySeries.entrySet().stream()
                .map(series -> new SeriesGroup(series.getKey(), series.getValue().entrySet().stream()
                        .map(season -> new SeriesGroup.SeasonGroup(season.getKey(), List.copyOf(season.getValue())))
                        .toList()))
                .toList();
    }
}
