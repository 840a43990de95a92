package com.poisearch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables under the {@code poi} prefix, checked when the application starts
 */
@Data
@Validated
@ConfigurationProperties(prefix = "poi")
public class PoiSearchProperties {

    @Valid
    private Store store = new Store();

    @Valid
    private Index index = new Index();

    @Valid
    private Query query = new Query();

    @Data
    public static class Store {
        /**
         * Logical name of the store the index is built from
         */
        @NotBlank
        private String name = "hx2a";

        /**
         * JDBC statement timeout; 0 disables it
         */
        @Min(0)
        private int queryTimeoutSeconds = 5;
    }

    @Data
    public static class Index {
        /**
         * Name used when tracing builds and refreshes
         */
        private String name = "poi kdcache";

        /**
         * Records fetched per cursor round trip at build or refresh
         */
        @Min(1)
        private int batchSize = 128;

        /**
         * Seconds before a new point of interest is guaranteed to show up in searches
         */
        @Min(0)
        private long stalenessSeconds = 10;

        /**
         * How far before the high-water mark a refresh starts re-reading, to pick up
         * transactions that committed late with an earlier timestamp
         */
        @Min(0)
        private long refreshOverlapMillis = 1000;

        /**
         * Maximum wait for a concurrent initial build
         */
        @Min(1)
        private long buildTimeoutSeconds = 30;
    }

    @Data
    public static class Query {
        /**
         * Maximum number of points returned by a search before asking to zoom in
         */
        @Min(1)
        private int displayCap = 100;
    }
}
