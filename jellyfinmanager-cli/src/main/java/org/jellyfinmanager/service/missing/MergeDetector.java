package org.jellyfinmanager.service.missing;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jellyfinmanager.model.dto.CatalogEpisode;
import org.jellyfinmanager.model.dto.EpisodeKey;
import org.jellyfinmanager.model.dto.MissingEpisode;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds aired episodes that are absent from the local library, ignoring episodes that look merged into
 * the preceding local file (e.g. a two-part finale stored as one file).
 * <p>
 * An absent episode is folded into the current chain when the anchoring local file runs at least
 * {@value #MERGE_THRESHOLD_PERCENT}% of the summed expected runtime of the chain. Only episodes of the
 * anchor's season can be folded.
 */
@Slf4j
@Component
public class MergeDetector {

    static final int MERGE_THRESHOLD_PERCENT = 85;
    static final int SPECIALS_SEASON = 0;

    /**
     * One transition of the scan: the next chain state and the episode to report, if any.
     */
    public record Step(ChainState state, Optional<MissingEpisode> missing) {
    }

    public List<MissingEpisode> detectMissing(List<CatalogEpisode> episodes, Map<EpisodeKey, Integer> localRuntimes,
                                              boolean includeSpecials) {
        return detectMissing(episodes, localRuntimes, includeSpecials, LocalDate.now());
    }

    /**
     * @param episodes      catalog episodes ordered by season then episode number
     * @param localRuntimes runtime in minutes of each episode present locally
     * @param today         reference date, episodes airing on or after it are not due yet
     */
    public List<MissingEpisode> detectMissing(List<CatalogEpisode> episodes, Map<EpisodeKey, Integer> localRuntimes,
                                              boolean includeSpecials, LocalDate today) {
        List<MissingEpisode> missing = new ArrayList<>();
        ChainState state = ChainState.INACTIVE;
        for (CatalogEpisode episode : episodes) {
            Step step = step(state, episode, localRuntimes.get(episode.getKey()), includeSpecials, today);
            state = step.state();
            step.missing().ifPresent(missing::add);
        }
        return missing;
    }

    public Step step(ChainState state, CatalogEpisode episode, Integer localRuntime, boolean includeSpecials, LocalDate today) {
        if (localRuntime != null) {
            return new Step(ChainState.anchoredAt(episode.getSeasonNumber(), Math.max(0, localRuntime), episode.getRuntimeMinutes()),
                    Optional.empty());
        }
        if (episode.getSeasonNumber() == SPECIALS_SEASON && !includeSpecials) {
            return new Step(state, Optional.empty());
        }
        if (!hasAired(episode.getAirDate(), today)) {
            return new Step(state, Optional.empty());
        }
        if (state.canExtend(episode.getSeasonNumber())) {
            ChainState extended = state.withExpected(episode.getRuntimeMinutes());
            if (coversChain(extended)) {
                log.debug("S{}E{} treated as merged into the preceding file ({} min observed, {} min expected)",
                        episode.getSeasonNumber(), episode.getEpisodeNumber(), extended.observedRuntime(), extended.expectedAccum());
                return new Step(extended, Optional.empty());
            }
            return new Step(extended.deactivate(), Optional.of(toMissing(episode)));
        }
        return new Step(state.deactivate(), Optional.of(toMissing(episode)));
    }

    static boolean coversChain(ChainState state) {
        return (long) state.observedRuntime() * 100 >= (long) MERGE_THRESHOLD_PERCENT * state.expectedAccum();
    }

    static boolean hasAired(String airDate, LocalDate today) {
        if (StringUtils.isBlank(airDate)) {
            return false;
        }
        try {
            return LocalDate.parse(airDate.trim()).isBefore(today);
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private MissingEpisode toMissing(CatalogEpisode episode) {
        return MissingEpisode.builder()
                .seasonNumber(episode.getSeasonNumber())
                .episodeNumber(episode.getEpisodeNumber())
                .name(episode.getName())
                .airDate(episode.getAirDate())
                .overview(episode.getOverview())
                .build();
    }
}
