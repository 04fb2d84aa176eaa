package org.jellyfinmanager.service.jellyfin;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jellyfinmanager.config.AppProperties;
import org.jellyfinmanager.exception.ApiError;
import org.jellyfinmanager.model.dto.LibraryItem;
import org.jellyfinmanager.model.dto.WatchedItem;
import org.jellyfinmanager.model.dto.response.jellyfin.JellyfinItemsResponse;
import org.jellyfinmanager.model.dto.response.jellyfin.JellyfinUser;
import org.jellyfinmanager.model.enums.ItemType;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Client for the Jellyfin REST API, scoped to the configured user.
 */
@Slf4j
@Service
public class JellyfinClient {

    private static final long TICKS_PER_MINUTE = 60L * 10 * 1000 * 1000;
    private static final String CLIENT_NAME = "Jellyfin Manager";

    private final AppProperties appProperties;
    private final RestClient restClient;

    private String userId;

    public JellyfinClient(AppProperties appProperties, RestClient.Builder restClientBuilder) {
        this.appProperties = appProperties;
        AppProperties.Jellyfin jellyfin = appProperties.getJellyfin();
        this.restClient = restClientBuilder.clone()
                .baseUrl(jellyfin.getServerUrl() != null ? jellyfin.getServerUrl() : "")
                .defaultHeader(HttpHeaders.AUTHORIZATION, authorizationHeader(jellyfin.getApiKey(), appProperties.getVersion()))
                .defaultHeader("X-Emby-Token", StringUtils.defaultString(jellyfin.getApiKey()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Resolves the id of the configured user by case-insensitive name. The result is cached for the
     * lifetime of the client.
     */
    public String getUserId() {
        if (userId != null) {
            return userId;
        }
        String userName = appProperties.getJellyfin().getUserName();
        List<JellyfinUser> users = execute("/Users", () -> restClient.get()
                .uri("/Users")
                .retrieve()
                .body(new ParameterizedTypeReference<List<JellyfinUser>>() {
                }));
        userId = (users == null ? Collections.<JellyfinUser>emptyList() : users).stream()
                .filter(user -> user.getName() != null && user.getName().equalsIgnoreCase(userName))
                .map(JellyfinUser::getId)
                .findFirst()
                .orElseThrow(() -> ApiError.JELLYFIN_USER_NOT_FOUND.createException(userName));
        log.debug("Resolved Jellyfin user '{}' to id {}", userName, userId);
        return userId;
    }

    public String getServerUrl() {
        return appProperties.getJellyfin().getServerUrl();
    }

    public String getUserName() {
        return appProperties.getJellyfin().getUserName();
    }

    public List<WatchedItem> getWatchedItems() {
        JellyfinItemsResponse response = getItems(builder -> builder
                .queryParam("Filters", "IsPlayed")
                .queryParam("Recursive", true)
                .queryParam("IncludeItemTypes", "Movie,Episode")
                .queryParam("Fields", "Path,ProviderIds,SeriesName,SeasonName"));

        return response.getItems().stream()
                .map(item -> WatchedItem.builder()
                        .id(item.getId())
                        .name(item.getName())
                        .type(ItemType.fromJellyfinType(item.getType()))
                        .seriesName(item.getSeriesName())
                        .seasonName(item.getSeasonName())
                        .playedDate(item.getUserData() != null ? item.getUserData().getLastPlayedDate() : null)
                        .providerIds(providerIds(item))
                        .build())
                .toList();
    }

    public List<LibraryItem> getAllMovies() {
        JellyfinItemsResponse response = getItems(builder -> builder
                .queryParam("Recursive", true)
                .queryParam("IncludeItemTypes", "Movie")
                .queryParam("Fields", "ProviderIds,UserData"));
        return response.getItems().stream().map(this::toLibraryItem).toList();
    }

    public List<LibraryItem> getAllSeries() {
        JellyfinItemsResponse response = getItems(builder -> builder
                .queryParam("Recursive", true)
                .queryParam("IncludeItemTypes", "Series")
                .queryParam("Fields", "ProviderIds"));
        return response.getItems().stream().map(this::toLibraryItem).toList();
    }

    public List<LibraryItem> getEpisodesForSeries(String seriesId) {
        JellyfinItemsResponse response = getItems(builder -> builder
                .queryParam("ParentId", seriesId)
                .queryParam("Recursive", true)
                .queryParam("IncludeItemTypes", "Episode")
                .queryParam("Fields", "ProviderIds,SeriesName,SeasonName,UserData"));
        return response.getItems().stream().map(this::toLibraryItem).toList();
    }

    /**
     * Finds the id of a series by name: an exact name match among the search results wins, otherwise
     * the first search result is used.
     */
    public String findSeriesId(String seriesName) {
        JellyfinItemsResponse response = getItems(builder -> builder
                .queryParam("SearchTerm", seriesName)
                .queryParam("IncludeItemTypes", "Series")
                .queryParam("Recursive", true)
                .queryParam("Limit", 10));

        List<JellyfinItemsResponse.Item> items = response.getItems();
        return items.stream()
                .filter(item -> seriesName.equals(item.getName()))
                .map(JellyfinItemsResponse.Item::getId)
                .findFirst()
                .or(() -> items.stream().map(JellyfinItemsResponse.Item::getId).findFirst())
                .orElseThrow(() -> ApiError.SERIES_NOT_FOUND.createException(seriesName));
    }

    public void markAsWatched(String itemId) {
        String uid = getUserId();
        execute("/UserPlayedItems/" + itemId, () -> restClient.post()
                .uri(builder -> builder.path("/UserPlayedItems/{itemId}").queryParam("userId", uid).build(itemId))
                .retrieve()
                .toBodilessEntity());
    }

    private JellyfinItemsResponse getItems(Function<UriBuilder, UriBuilder> query) {
        String uid = getUserId();
        JellyfinItemsResponse response = execute("/Items", () -> restClient.get()
                .uri(builder -> query.apply(builder.path("/Items").queryParam("userId", uid)).build())
                .retrieve()
                .body(JellyfinItemsResponse.class));
        if (response == null || response.getItems() == null) {
            return JellyfinItemsResponse.builder().build();
        }
        return response;
    }

    private LibraryItem toLibraryItem(JellyfinItemsResponse.Item item) {
        long ticks = item.getRunTimeTicks() != null ? item.getRunTimeTicks() : 0L;
        return LibraryItem.builder()
                .id(item.getId())
                .name(item.getName())
                .played(item.getUserData() != null && item.getUserData().isPlayed())
                .providerIds(providerIds(item))
                .seriesName(item.getSeriesName())
                .seasonName(item.getSeasonName())
                .seasonNumber(item.getParentIndexNumber())
                .episodeNumber(item.getIndexNumber())
                .runtimeMinutes((int) Math.max(0, ticks / TICKS_PER_MINUTE))
                .build();
    }

    private Map<String, String> providerIds(JellyfinItemsResponse.Item item) {
        return item.getProviderIds() != null ? new LinkedHashMap<>(item.getProviderIds()) : new LinkedHashMap<>();
    }

    private <T> T execute(String endpoint, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientException e) {
            throw ApiError.JELLYFIN_REQUEST_FAILED.createException(e, endpoint, e.getMessage());
        }
    }

    static String authorizationHeader(String apiKey, String version) {
        return String.format("MediaBrowser Client=\"%s\", Device=\"Java Client\", DeviceId=\"jellyfin-manager\", Version=\"%s\", Token=\"%s\"",
                CLIENT_NAME, StringUtils.defaultIfBlank(version, "1.0.0"), StringUtils.defaultString(apiKey));
    }
}
