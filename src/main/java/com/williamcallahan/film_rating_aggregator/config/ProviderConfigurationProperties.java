/**
 * Film provider connection properties
 *
 * @author William Callahan
 */

package com.williamcallahan.film_rating_aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "providers")
public class ProviderConfigurationProperties {

    @NestedConfigurationProperty
    private Provider tmdb = new Provider("https://api.themoviedb.org/3", Duration.ofHours(24));

    @NestedConfigurationProperty
    private Provider omdb = new Provider("https://www.omdbapi.com", Duration.ofHours(12));

    @NestedConfigurationProperty
    private Provider kinopoisk = new Provider("https://kinopoiskapiunofficial.tech/api/v2.2", Duration.ofHours(6));

    public Provider getTmdb() { return tmdb; }
    public void setTmdb(Provider tmdb) { this.tmdb = tmdb; }

    public Provider getOmdb() { return omdb; }
    public void setOmdb(Provider omdb) { this.omdb = omdb; }

    public Provider getKinopoisk() { return kinopoisk; }
    public void setKinopoisk(Provider kinopoisk) { this.kinopoisk = kinopoisk; }

    public static class Provider {
        private String baseUrl;
        private String apiKey;
        private Duration cacheTtl;
        private String language = "en-US";

        public Provider() {
        }

        public Provider(String baseUrl, Duration cacheTtl) {
            this.baseUrl = baseUrl;
            this.cacheTtl = cacheTtl;
        }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }

        public String getLanguage() { return language; }
        public void setLanguage(String language) { this.language = language; }
    }
}
