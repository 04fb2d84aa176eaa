package org.jellyfinmanager.service.event;

import lombok.extern.slf4j.Slf4j;
import org.jellyfinmanager.model.dto.LibraryItem;
import org.jellyfinmanager.model.dto.MissingEpisode;
import org.jellyfinmanager.model.dto.MissingEpisodeSummary;
import org.jellyfinmanager.model.dto.RestoreResult;
import org.jellyfinmanager.model.dto.WatchedItem;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reports the outcome of every reconciliation step. Output goes to the application log.
 */
@Slf4j
@Service
public class ReconciliationEventBroadcaster {

    public void broadcastMissingEpisodes(int position, int total, String seriesName, String tvdbId,
                                         List<MissingEpisode> missing, int catalogEpisodeCount) {
        log.info("[{}/{}] {} (TVDB: {})", position, total, seriesName, tvdbId);
        log.info("  ⚠ Missing {} episodes (of {} total):", missing.size(), catalogEpisodeCount);
        for (MissingEpisode episode : missing) {
            log.info("    - {}: {} (Aired: {})", episode.getCode(), episode.getName(), episode.getAirDate());
        }
    }

    public void broadcastSeriesSkipped(int position, int total, String seriesName, String reason) {
        log.warn("[{}/{}] {}: ⚠ {}", position, total, seriesName, reason);
    }

    public void broadcastMissingSummary(MissingEpisodeSummary summary) {
        log.info("=== Summary ===");
        log.info("Total series checked: {}", summary.seriesChecked());
        if (summary.seriesFailed() > 0) {
            log.info("Series that could not be checked: {}", summary.seriesFailed());
        }
        log.info("Total missing episodes: {}", summary.totalMissing());
    }

    public void broadcastItemNotFound(WatchedItem item) {
        log.warn("  ✗ {} - not found", item.getName());
    }

    public void broadcastItemAlreadyWatched(WatchedItem item, LibraryItem target) {
        log.debug("  ○ {} - already watched ({}), skipping", item.getName(), target.getId());
    }

    public void broadcastItemMarked(WatchedItem item, LibraryItem target) {
        log.debug("  ✓ {} - marked as watched ({})", item.getName(), target.getId());
    }

    public void broadcastMarkFailed(WatchedItem item, LibraryItem target, Exception cause) {
        log.warn("  ✗ {} - failed to mark {} as watched: {}", item.getName(), target.getId(), cause.getMessage());
    }

    public void broadcastSeriesFailed(String seriesName, int episodeCount, Exception cause) {
        log.warn("  ✗ {}: {} ({} episodes counted as failed)", seriesName, cause.getMessage(), episodeCount);
    }

    public void broadcastIdentityCollision(String key, LibraryItem previous, LibraryItem replacement) {
        log.warn("  Duplicate key '{}' shared by '{}' ({}) and '{}' ({}), using the latter",
                key, previous.getName(), previous.getId(), replacement.getName(), replacement.getId());
    }

    public void broadcastRestoreSummary(RestoreResult result, int total) {
        log.info("=== Restore Complete ===");
        log.info("Successful: {}", result.successful());
        log.info("Failed: {}", result.failed());
        log.info("Total: {}", total);
    }
}
