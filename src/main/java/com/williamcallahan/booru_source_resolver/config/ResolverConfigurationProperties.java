/**
 * Resolver configuration properties
 * Centralizes all resolver.* configuration properties for type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.booru_source_resolver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;

@Component
@ConfigurationProperties(prefix = "resolver")
public class ResolverConfigurationProperties {

    @NestedConfigurationProperty
    private Fetch fetch = new Fetch();

    @NestedConfigurationProperty
    private Locator locator = new Locator();

    @NestedConfigurationProperty
    private Tiles tiles = new Tiles();

    @NestedConfigurationProperty
    private Backup backup = new Backup();

    @NestedConfigurationProperty
    private DeviantArt deviantart = new DeviantArt();

    @NestedConfigurationProperty
    private Tumblr tumblr = new Tumblr();

    // Getters and setters
    public Fetch getFetch() { return fetch; }
    public void setFetch(Fetch fetch) { this.fetch = fetch; }

    public Locator getLocator() { return locator; }
    public void setLocator(Locator locator) { this.locator = locator; }

    public Tiles getTiles() { return tiles; }
    public void setTiles(Tiles tiles) { this.tiles = tiles; }

    public Backup getBackup() { return backup; }
    public void setBackup(Backup backup) { this.backup = backup; }

    public DeviantArt getDeviantart() { return deviantart; }
    public void setDeviantart(DeviantArt deviantart) { this.deviantart = deviantart; }

    public Tumblr getTumblr() { return tumblr; }
    public void setTumblr(Tumblr tumblr) { this.tumblr = tumblr; }

    // Nested configuration classes
    public static class Fetch {
        private String userAgent = "booru-source-resolver/0.1";
        private Duration permitWaitInterval = Duration.ofMillis(10);
        private int retryBudget = 3;
        private int locatorRetryBudget = 5;
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration maxRetryAfter = Duration.ofSeconds(120);
        private int connectTimeoutMillis = 5000;
        private int readTimeoutSeconds = 30;
        private int writeTimeoutSeconds = 30;
        private Duration responseTimeout = Duration.ofSeconds(30);
        private int maxInMemorySizeMb = 256;

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public Duration getPermitWaitInterval() { return permitWaitInterval; }
        public void setPermitWaitInterval(Duration permitWaitInterval) { this.permitWaitInterval = permitWaitInterval; }

        public int getRetryBudget() { return retryBudget; }
        public void setRetryBudget(int retryBudget) { this.retryBudget = retryBudget; }

        public int getLocatorRetryBudget() { return locatorRetryBudget; }
        public void setLocatorRetryBudget(int locatorRetryBudget) { this.locatorRetryBudget = locatorRetryBudget; }

        public Duration getRetryBaseDelay() { return retryBaseDelay; }
        public void setRetryBaseDelay(Duration retryBaseDelay) { this.retryBaseDelay = retryBaseDelay; }

        public Duration getMaxRetryAfter() { return maxRetryAfter; }
        public void setMaxRetryAfter(Duration maxRetryAfter) { this.maxRetryAfter = maxRetryAfter; }

        public int getConnectTimeoutMillis() { return connectTimeoutMillis; }
        public void setConnectTimeoutMillis(int connectTimeoutMillis) { this.connectTimeoutMillis = connectTimeoutMillis; }

        public int getReadTimeoutSeconds() { return readTimeoutSeconds; }
        public void setReadTimeoutSeconds(int readTimeoutSeconds) { this.readTimeoutSeconds = readTimeoutSeconds; }

        public int getWriteTimeoutSeconds() { return writeTimeoutSeconds; }
        public void setWriteTimeoutSeconds(int writeTimeoutSeconds) { this.writeTimeoutSeconds = writeTimeoutSeconds; }

        public Duration getResponseTimeout() { return responseTimeout; }
        public void setResponseTimeout(Duration responseTimeout) { this.responseTimeout = responseTimeout; }

        public int getMaxInMemorySizeMb() { return maxInMemorySizeMb; }
        public void setMaxInMemorySizeMb(int maxInMemorySizeMb) { this.maxInMemorySizeMb = maxInMemorySizeMb; }
    }

    public static class Locator {
        private boolean enabled = true;
        private int dayRadius = 27;
        private String cutoffDate = "2019-03-01"; // Direct-storage paths stopped being date-sharded after this

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getDayRadius() { return dayRadius; }
        public void setDayRadius(int dayRadius) { this.dayRadius = dayRadius; }

        public String getCutoffDate() { return cutoffDate; }
        public void setCutoffDate(String cutoffDate) { this.cutoffDate = cutoffDate; }

        public LocalDate cutoffLocalDate() {
            return cutoffDate == null || cutoffDate.isBlank() ? null : LocalDate.parse(cutoffDate.trim());
        }
    }

    public static class Tiles {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Backup {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration archiveCacheTtl = Duration.ofMinutes(10);
        private int archiveCacheMaxSize = 16;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public Duration getArchiveCacheTtl() { return archiveCacheTtl; }
        public void setArchiveCacheTtl(Duration archiveCacheTtl) { this.archiveCacheTtl = archiveCacheTtl; }

        public int getArchiveCacheMaxSize() { return archiveCacheMaxSize; }
        public void setArchiveCacheMaxSize(int archiveCacheMaxSize) { this.archiveCacheMaxSize = archiveCacheMaxSize; }
    }

    public static class DeviantArt {
        private boolean enabled = true;
        private String baseUrl = "https://www.deviantart.com";
        private String clientId;
        private String clientSecret;
        private String refreshToken;
        private String cookie;
        private boolean stashEnabled = true;
        private String stashConsoleApp = "0f1832daa6b58a05841ec6058520c4f3"; // API console page that issues stash_submit tokens

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }

        public String getClientSecret() { return clientSecret; }
        public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }

        public String getRefreshToken() { return refreshToken; }
        public void setRefreshToken(String refreshToken) { this.refreshToken = refreshToken; }

        public String getCookie() { return cookie; }
        public void setCookie(String cookie) { this.cookie = cookie; }

        public boolean isStashEnabled() { return stashEnabled; }
        public void setStashEnabled(boolean stashEnabled) { this.stashEnabled = stashEnabled; }

        public String getStashConsoleApp() { return stashConsoleApp; }
        public void setStashConsoleApp(String stashConsoleApp) { this.stashConsoleApp = stashConsoleApp; }

        public boolean hasCookie() {
            return cookie != null && !cookie.isBlank();
        }

        public boolean hasCredentials() {
            return clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank()
                && refreshToken != null && !refreshToken.isBlank();
        }
    }

    public static class Tumblr {
        private boolean enabled = true;
        private String baseUrl = "https://www.tumblr.com";
        private String bearerToken;
        private String cookie;
        private Duration csrfTtl = Duration.ofMinutes(30);
        private boolean upscaleEnabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getBearerToken() { return bearerToken; }
        public void setBearerToken(String bearerToken) { this.bearerToken = bearerToken; }

        public String getCookie() { return cookie; }
        public void setCookie(String cookie) { this.cookie = cookie; }

        public Duration getCsrfTtl() { return csrfTtl; }
        public void setCsrfTtl(Duration csrfTtl) { this.csrfTtl = csrfTtl; }

        public boolean isUpscaleEnabled() { return upscaleEnabled; }
        public void setUpscaleEnabled(boolean upscaleEnabled) { this.upscaleEnabled = upscaleEnabled; }

        public boolean hasCredentials() {
            return cookie != null && !cookie.isBlank() && bearerToken != null && !bearerToken.isBlank();
        }
    }
}
