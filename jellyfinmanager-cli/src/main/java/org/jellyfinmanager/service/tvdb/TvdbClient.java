package org.jellyfinmanager.service.tvdb;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jellyfinmanager.config.AppProperties;
import org.jellyfinmanager.exception.ApiError;
import org.jellyfinmanager.model.dto.CatalogEpisode;
import org.jellyfinmanager.model.dto.response.tvdb.TvdbEpisode;
import org.jellyfinmanager.model.dto.response.tvdb.TvdbEpisodePage;
import org.jellyfinmanager.model.dto.response.tvdb.TvdbLoginData;
import org.jellyfinmanager.model.dto.response.tvdb.TvdbResponse;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for the TVDB v4 API. {@link #login()} must succeed before any other call.
 */
@Slf4j
@Service
public class TvdbClient {

    private static final int MAX_PAGES = 500;

    private final AppProperties appProperties;
    private final RestClient restClient;

    private String token;

    public TvdbClient(AppProperties appProperties, RestClient.Builder restClientBuilder) {
        this.appProperties = appProperties;
        this.restClient = restClientBuilder.clone()
                .baseUrl(appProperties.getTvdb().getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    public void login() {
        String apiKey = appProperties.getTvdb().getApiKey();
        if (StringUtils.isBlank(apiKey)) {
            throw ApiError.MISSING_CONFIGURATION.createException("TVDB API key");
        }
        TvdbResponse<TvdbLoginData> response;
        try {
            response = restClient.post()
                    .uri("/login")
                    .body(Map.of("apikey", apiKey))
                    .retrieve()
                    .body(new ParameterizedTypeReference<TvdbResponse<TvdbLoginData>>() {
                    });
        } catch (RestClientException e) {
            throw ApiError.TVDB_LOGIN_FAILED.createException(e, e.getMessage());
        }
        if (response == null || response.getData() == null || StringUtils.isBlank(response.getData().getToken())) {
            throw ApiError.TVDB_LOGIN_FAILED.createException("no token in response");
        }
        token = response.getData().getToken();
        log.debug("TVDB authentication successful");
    }

    public boolean isAuthenticated() {
        return token != null;
    }

    /**
     * Fetches every page of the default episode order of a series.
     */
    public List<CatalogEpisode> getSeriesEpisodes(String tvdbId) {
        List<CatalogEpisode> episodes = new ArrayList<>();
        int page = 0;
        while (page < MAX_PAGES) {
            TvdbResponse<TvdbEpisodePage> response = get("/series/" + tvdbId + "/episodes/default?page=" + page,
                    new ParameterizedTypeReference<TvdbResponse<TvdbEpisodePage>>() {
                    });
            if (response == null || response.getData() == null) {
                break;
            }
            List<TvdbEpisode> pageEpisodes = response.getData().getEpisodes();
            if (pageEpisodes != null) {
                pageEpisodes.stream().map(TvdbClient::toCatalogEpisode).forEach(episodes::add);
            }
            if (!response.hasNextPage()) {
                break;
            }
            page++;
        }
        log.debug("Fetched {} TVDB episodes for series {} in {} page(s)", episodes.size(), tvdbId, page + 1);
        return episodes;
    }

    private <T> T get(String endpoint, ParameterizedTypeReference<T> type) {
        if (token == null) {
            throw ApiError.TVDB_NOT_AUTHENTICATED.createException();
        }
        try {
            return restClient.get()
                    .uri(endpoint)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .retrieve()
                    .body(type);
        } catch (RestClientException e) {
            throw ApiError.TVDB_REQUEST_FAILED.createException(e, endpoint, e.getMessage());
        }
    }

    static CatalogEpisode toCatalogEpisode(TvdbEpisode episode) {
        return CatalogEpisode.builder()
                .seriesId(episode.getSeriesId())
                .seasonNumber(episode.getSeasonNumber() != null ? episode.getSeasonNumber() : 0)
                .episodeNumber(episode.getNumber() != null ? episode.getNumber() : 0)
                .name(episode.getName())
                .overview(episode.getOverview())
                .airDate(episode.getAired())
                .runtimeMinutes(episode.getRuntimeMinutes() != null ? Math.max(0, episode.getRuntimeMinutes()) : 0)
                .build();
    }
}
