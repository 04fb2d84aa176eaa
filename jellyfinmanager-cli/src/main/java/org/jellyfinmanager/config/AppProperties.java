package org.jellyfinmanager.config;

import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {
    private String version;
    private String backupFile = "jellyfin-watched-backup.json";
    private boolean includeSpecials;
    private Jellyfin jellyfin = new Jellyfin();
    private Tvdb tvdb = new Tvdb();
    private Http http = new Http();

    @Getter
    @Setter
    public static class Jellyfin {
        private String serverUrl;
        private String apiKey;
        private String userName;

        public String getServerUrl() {
            return StringUtils.removeEnd(StringUtils.trimToNull(serverUrl), "/");
        }

        public boolean isConfigured() {
            return StringUtils.isNoneBlank(serverUrl, apiKey, userName);
        }
    }

    @Getter
    @Setter
    public static class Tvdb {
        private String apiKey;
        private String baseUrl = "https://api4.thetvdb.com/v4";
    }

    @Getter
    @Setter
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
