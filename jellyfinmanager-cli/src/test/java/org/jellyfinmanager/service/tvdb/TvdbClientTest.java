package org.jellyfinmanager.service.tvdb;

import org.jellyfinmanager.config.AppProperties;
import org.jellyfinmanager.exception.APIException;
import org.jellyfinmanager.exception.ApiError;
import org.jellyfinmanager.model.dto.CatalogEpisode;
import org.jellyfinmanager.model.dto.response.tvdb.TvdbEpisode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TvdbClientTest {

    private static final String BASE_URL = "https://tvdb.test/v4";

    private AppProperties appProperties;
    private MockRestServiceServer server;
    private TvdbClient tvdbClient;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getTvdb().setBaseUrl(BASE_URL);
        appProperties.getTvdb().setApiKey("tvdb-key");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        tvdbClient = new TvdbClient(appProperties, builder);
    }

    @Test
    void login_shouldStoreToken() {
        expectLogin();

        assertFalse(tvdbClient.isAuthenticated());
        tvdbClient.login();

        assertTrue(tvdbClient.isAuthenticated());
        server.verify();
    }

    @Test
    void login_shouldThrow_whenApiKeyIsMissing() {
        appProperties.getTvdb().setApiKey(" ");

        APIException ex = assertThrows(APIException.class, () -> tvdbClient.login());

        assertEquals(ApiError.MISSING_CONFIGURATION, ex.getError());
    }

    @Test
    void login_shouldThrow_whenRejected() {
        server.expect(requestTo(BASE_URL + "/login"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        APIException ex = assertThrows(APIException.class, () -> tvdbClient.login());

        assertEquals(ApiError.TVDB_LOGIN_FAILED, ex.getError());
        assertFalse(tvdbClient.isAuthenticated());
    }

    @Test
    void login_shouldThrow_whenResponseHasNoToken() {
        server.expect(requestTo(BASE_URL + "/login"))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{}}", MediaType.APPLICATION_JSON));

        APIException ex = assertThrows(APIException.class, () -> tvdbClient.login());

        assertEquals(ApiError.TVDB_LOGIN_FAILED, ex.getError());
    }

    @Test
    void getSeriesEpisodes_shouldRequireLogin() {
        APIException ex = assertThrows(APIException.class, () -> tvdbClient.getSeriesEpisodes("100"));

        assertEquals(ApiError.TVDB_NOT_AUTHENTICATED, ex.getError());
    }

    @Test
    void getSeriesEpisodes_shouldFollowPagesUntilNextIsEmpty() {
        expectLogin();
        server.expect(requestTo(BASE_URL + "/series/100/episodes/default?page=0"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer tok-123"))
                .andRespond(withSuccess("""
                        {"status":"success",
                         "data":{"episodes":[
                           {"seriesId":100,"seasonNumber":1,"number":1,"name":"Pilot","aired":"2010-01-01","runtime":44},
                           {"seriesId":100,"seasonNumber":1,"number":2,"name":"Second","aired":null,"runtime":null}
                         ]},
                         "links":{"next":"https://tvdb.test/v4/series/100/episodes/default?page=1"}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/series/100/episodes/default?page=1"))
                .andRespond(withSuccess("""
                        {"status":"success",
                         "data":{"episodes":[{"seriesId":100,"seasonNumber":2,"number":1,"name":"Return","aired":"2011-01-01","runtime":50}]},
                         "links":{"next":null}}
                        """, MediaType.APPLICATION_JSON));

        tvdbClient.login();
        List<CatalogEpisode> episodes = tvdbClient.getSeriesEpisodes("100");

        assertThat(episodes).extracting(CatalogEpisode::getName).containsExactly("Pilot", "Second", "Return");
        CatalogEpisode pilot = episodes.get(0);
        assertEquals(44, pilot.getRuntimeMinutes());
        assertEquals("2010-01-01", pilot.getAirDate());
        assertEquals(100, pilot.getSeriesId());
        assertEquals(0, episodes.get(1).getRuntimeMinutes());
        assertNull(episodes.get(1).getAirDate());
        assertEquals(2, episodes.get(2).getSeasonNumber());
        server.verify();
    }

    @Test
    void getSeriesEpisodes_shouldWrapTransportErrors() {
        expectLogin();
        server.expect(requestTo(BASE_URL + "/series/7/episodes/default?page=0"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        tvdbClient.login();
        APIException ex = assertThrows(APIException.class, () -> tvdbClient.getSeriesEpisodes("7"));

        assertEquals(ApiError.TVDB_REQUEST_FAILED, ex.getError());
    }

    @Test
    void toCatalogEpisode_shouldTreatMissingNumbersAsZero() {
        CatalogEpisode episode = TvdbClient.toCatalogEpisode(TvdbEpisode.builder().name("Unnumbered").runtimeMinutes(-5).build());

        assertEquals(0, episode.getSeasonNumber());
        assertEquals(0, episode.getEpisodeNumber());
        assertEquals(0, episode.getRuntimeMinutes());
    }

    private void expectLogin() {
        server.expect(requestTo(BASE_URL + "/login"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.apikey").value("tvdb-key"))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"token\":\"tok-123\"}}", MediaType.APPLICATION_JSON));
    }
}
