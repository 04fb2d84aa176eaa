package org.jellyfinmanager.service.missing;

import org.jellyfinmanager.model.dto.CatalogEpisode;
import org.jellyfinmanager.model.dto.EpisodeKey;
import org.jellyfinmanager.model.dto.MissingEpisode;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MergeDetectorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);
    private static final String AIRED = "2020-01-01";

    private final MergeDetector mergeDetector = new MergeDetector();

    @Test
    void detectMissing_shouldReportEveryAiredEpisodeExceptSpecials_whenNothingIsLocal() {
        List<CatalogEpisode> episodes = List.of(
                episode(0, 1, 30, AIRED),
                episode(1, 1, 45, AIRED),
                episode(1, 2, 45, AIRED),
                episode(2, 1, 45, AIRED));

        List<MissingEpisode> missing = mergeDetector.detectMissing(episodes, Map.of(), false, TODAY);

        assertThat(missing).extracting(MissingEpisode::getCode).containsExactly("S01E01", "S01E02", "S02E01");
    }

    @Test
    void detectMissing_shouldIncludeSpecials_whenRequested() {
        List<CatalogEpisode> episodes = List.of(
                episode(0, 1, 30, AIRED),
                episode(0, 2, 30, AIRED),
                episode(1, 1, 45, AIRED));

        List<MissingEpisode> missing = mergeDetector.detectMissing(episodes, Map.of(), true, TODAY);

        assertThat(missing).extracting(MissingEpisode::getCode).containsExactly("S00E01", "S00E02", "S01E01");
    }

    @Test
    void detectMissing_shouldCarryEpisodeDetails() {
        CatalogEpisode episode = CatalogEpisode.builder()
                .seasonNumber(3).episodeNumber(7).name("The Rains").overview("It pours.")
                .airDate("2019-05-05").runtimeMinutes(42).build();

        List<MissingEpisode> missing = mergeDetector.detectMissing(List.of(episode), Map.of(), false, TODAY);

        assertThat(missing).singleElement().satisfies(m -> {
            assertThat(m.getSeasonNumber()).isEqualTo(3);
            assertThat(m.getEpisodeNumber()).isEqualTo(7);
            assertThat(m.getName()).isEqualTo("The Rains");
            assertThat(m.getAirDate()).isEqualTo("2019-05-05");
            assertThat(m.getOverview()).isEqualTo("It pours.");
        });
    }

    @Test
    void detectMissing_shouldReportEpisode_whenLocalFileIsJustBelowThreshold() {
        List<CatalogEpisode> episodes = List.of(episode(1, 1, 100, AIRED), episode(1, 2, 20, AIRED));

        List<MissingEpisode> missing = mergeDetector.detectMissing(episodes, local(1, 1, 100), false, TODAY);

        assertThat(missing).extracting(MissingEpisode::getCode).containsExactly("S01E02");
    }

    @Test
    void detectMissing_shouldFoldEpisode_whenLocalFileReachesThreshold() {
        List<CatalogEpisode> episodes = List.of(episode(1, 1, 100, AIRED), episode(1, 2, 20, AIRED));

        List<MissingEpisode> missing = mergeDetector.detectMissing(episodes, local(1, 1, 102), false, TODAY);

        assertThat(missing).isEmpty();
    }

    @Test
    void detectMissing_shouldExtendChainAcrossSeveralEpisodes_untilRuntimeRunsOut() {
        List<CatalogEpisode> episodes = List.of(
                episode(1, 1, 45, AIRED),
                episode(1, 2, 45, AIRED),
                episode(1, 3, 45, AIRED),
                episode(1, 4, 45, AIRED));

        // 90 >= 0.85 * 90 folds E2, 90 < 0.85 * 135 breaks on E3
        List<MissingEpisode> missing = mergeDetector.detectMissing(episodes, local(1, 1, 90), false, TODAY);

        assertThat(missing).extracting(MissingEpisode::getCode).containsExactly("S01E03", "S01E04");
    }

    @Test
    void detectMissing_shouldFoldThreePartFile() {
        List<CatalogEpisode> episodes = List.of(
                episode(1, 1, 40, AIRED),
                episode(1, 2, 40, AIRED),
                episode(1, 3, 40, AIRED),
                episode(1, 4, 40, AIRED));
        Map<EpisodeKey, Integer> local = local(1, 1, 115);
        local.put(new EpisodeKey(1, 4), 40);

        assertThat(mergeDetector.detectMissing(episodes, local, false, TODAY)).isEmpty();
    }

    @Test
    void detectMissing_shouldNeverFoldAcrossSeasons() {
        List<CatalogEpisode> episodes = List.of(episode(1, 10, 45, AIRED), episode(2, 1, 20, AIRED));

        List<MissingEpisode> missing = mergeDetector.detectMissing(episodes, local(1, 10, 500), false, TODAY);

        assertThat(missing).extracting(MissingEpisode::getCode).containsExactly("S02E01");
    }

    @Test
    void detectMissing_shouldRestartChain_onNextLocalEpisode() {
        List<CatalogEpisode> episodes = List.of(
                episode(1, 1, 45, AIRED),
                episode(1, 2, 45, AIRED),
                episode(1, 3, 45, AIRED),
                episode(1, 4, 45, AIRED));
        Map<EpisodeKey, Integer> local = local(1, 1, 45);
        local.put(new EpisodeKey(1, 3), 90);

        List<MissingEpisode> missing = mergeDetector.detectMissing(episodes, local, false, TODAY);

        assertThat(missing).extracting(MissingEpisode::getCode).containsExactly("S01E02");
    }

    @Test
    void detectMissing_shouldIgnoreUnairedEpisodes_withoutConsumingChain() {
        List<CatalogEpisode> episodes = List.of(
                episode(1, 1, 50, AIRED),
                episode(1, 2, 50, "not-a-date"),
                episode(1, 3, 50, AIRED));

        // E2 must not add its runtime: 100 >= 0.85 * 100 folds E3, 0.85 * 150 would not
        List<MissingEpisode> missing = mergeDetector.detectMissing(episodes, local(1, 1, 100), false, TODAY);

        assertThat(missing).isEmpty();
    }

    @Test
    void detectMissing_shouldTreatTodayFutureAndBlankAirDatesAsNotAired() {
        List<CatalogEpisode> episodes = List.of(
                episode(1, 1, 45, TODAY.toString()),
                episode(1, 2, 45, TODAY.plusDays(1).toString()),
                episode(1, 3, 45, ""),
                episode(1, 4, 45, null),
                episode(1, 5, 45, TODAY.minusDays(1).toString()));

        List<MissingEpisode> missing = mergeDetector.detectMissing(episodes, Map.of(), false, TODAY);

        assertThat(missing).extracting(MissingEpisode::getCode).containsExactly("S01E05");
    }

    @Test
    void detectMissing_shouldNotLetSkippedSpecialBreakChain() {
        List<CatalogEpisode> episodes = List.of(
                episode(1, 1, 45, AIRED),
                episode(0, 1, 45, AIRED),
                episode(1, 2, 45, AIRED));

        assertThat(mergeDetector.detectMissing(episodes, local(1, 1, 90), false, TODAY)).isEmpty();
    }

    @Test
    void detectMissing_shouldTreatZeroRuntimesAsUnknown() {
        List<CatalogEpisode> episodes = List.of(episode(1, 1, 0, AIRED), episode(1, 2, 0, AIRED));

        // 0 >= 0.85 * 0 holds, so an episode without runtime data folds into a file without one
        assertThat(mergeDetector.detectMissing(episodes, local(1, 1, 0), false, TODAY)).isEmpty();
    }

    @Test
    void detectMissing_shouldBeRepeatable() {
        List<CatalogEpisode> episodes = List.of(
                episode(1, 1, 45, AIRED),
                episode(1, 2, 45, AIRED),
                episode(1, 3, 45, AIRED));
        Map<EpisodeKey, Integer> local = local(1, 1, 80);

        List<MissingEpisode> first = mergeDetector.detectMissing(episodes, local, false, TODAY);
        List<MissingEpisode> second = mergeDetector.detectMissing(episodes, local, false, TODAY);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void step_shouldAnchorChainOnLocalEpisode() {
        MergeDetector.Step step = mergeDetector.step(ChainState.INACTIVE, episode(2, 4, 40, AIRED), 85, false, TODAY);

        assertThat(step.state()).isEqualTo(new ChainState(true, 2, 85, 40));
        assertThat(step.missing()).isEmpty();
    }

    @Test
    void step_shouldDeactivateChain_whenFoldFails() {
        ChainState state = ChainState.anchoredAt(1, 40, 40);

        MergeDetector.Step step = mergeDetector.step(state, episode(1, 2, 40, AIRED), null, false, TODAY);

        assertThat(step.state().active()).isFalse();
        assertThat(step.missing()).isPresent();
    }

    @Test
    void step_shouldLeaveStateUntouched_forUnairedEpisode() {
        ChainState state = ChainState.anchoredAt(1, 40, 40);

        MergeDetector.Step step = mergeDetector.step(state, episode(1, 2, 40, "2099-01-01"), null, false, TODAY);

        assertThat(step.state()).isSameAs(state);
        assertThat(step.missing()).isEmpty();
    }

    private static CatalogEpisode episode(int season, int number, int runtime, String airDate) {
        return CatalogEpisode.builder()
                .seriesId(1)
                .seasonNumber(season)
                .episodeNumber(number)
                .name("Episode " + number)
                .airDate(airDate)
                .runtimeMinutes(runtime)
                .build();
    }

    private static Map<EpisodeKey, Integer> local(int season, int number, int runtime) {
        Map<EpisodeKey, Integer> local = new HashMap<>();
        local.put(new EpisodeKey(season, number), runtime);
        return local;
    }
}
