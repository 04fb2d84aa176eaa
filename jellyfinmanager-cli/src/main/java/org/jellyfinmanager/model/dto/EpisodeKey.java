package org.jellyfinmanager.model.dto;

public record EpisodeKey(int seasonNumber, int episodeNumber) {

    @Override
    public String toString() {
        return seasonNumber + ":" + episodeNumber;
    }
}
