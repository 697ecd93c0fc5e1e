/**
 * Main application class for the film rating aggregator
 *
 * @author William Callahan
 *
 * Features:
 * - Runs without a web server; WebFlux is used for its WebClient only
 * - Enables caching for search results
 * - Enables scheduling for request-monitor counter resets
 */

package com.williamcallahan.film_rating_aggregator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableCaching
@EnableAsync
@EnableScheduling
public class FilmRatingAggregatorApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(FilmRatingAggregatorApplication.class, args);
    }
}
