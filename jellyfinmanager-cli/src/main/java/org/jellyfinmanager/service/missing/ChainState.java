package org.jellyfinmanager.service.missing;

/**
 * Fold accumulator of {@link MergeDetector}: the run of same-season episodes that may be merged into
 * the last local file seen.
 *
 * @param active          whether a chain is open
 * @param season          season of the local file anchoring the chain
 * @param observedRuntime runtime of that local file, in minutes
 * @param expectedAccum   summed expected runtime of every episode folded into the chain so far
 */
public record ChainState(boolean active, int season, int observedRuntime, int expectedAccum) {

    public static final ChainState INACTIVE = new ChainState(false, 0, 0, 0);

    public static ChainState anchoredAt(int season, int observedRuntime, int expectedRuntime) {
        return new ChainState(true, season, observedRuntime, expectedRuntime);
    }

    public boolean canExtend(int episodeSeason) {
        return active && season == episodeSeason;
    }

    public ChainState withExpected(int runtimeMinutes) {
        return new ChainState(active, season, observedRuntime, expectedAccum + runtimeMinutes);
    }

    public ChainState deactivate() {
        return active ? new ChainState(false, season, observedRuntime, expectedAccum) : this;
    }
}
