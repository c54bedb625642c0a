package com.al.shopsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the migration service.
 * Loaded from the {@code shop-sync} section of application.yml
 */
@Configuration
@ConfigurationProperties(prefix = "shop-sync")
@Data
public class ShopSyncProperties {

    /**
     * Shopware 5 connection
     */
    private Source source = new Source();

    /**
     * Shopify connection
     */
    private Target target = new Target();

    /**
     * Batching and concurrency of sync runs
     */
    private Sync sync = new Sync();

    /**
     * Mapping store and import/export settings
     */
    private Mapping mapping = new Mapping();

    /**
     * Transformation rule settings
     */
    private Transform transform = new Transform();

    /**
     * Sync event publishing
     */
    private Events events = new Events();

    /**
     * Field catalog cache
     */
    private Cache cache = new Cache();

    @Data
    public static class Source {
        /**
         * Base URL of the Shopware 5 REST API, e.g. https://shop.example.com/api
         */
        private String url = "http://localhost/api";

        private String username;

        /**
         * API key of the Shopware backend user (used as basic auth password)
         */
        private String apiKey;

        /**
         * Records sampled when enumerating source fields without an identifier
         */
        private int fieldSampleSize = 5;

        private Duration connectTimeout = Duration.ofSeconds(10);

        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Target {
        /**
         * Shop domain, e.g. my-store.myshopify.com
         */
        private String shopUrl = "localhost";

        private String accessToken;

        private String apiVersion = "2024-01";

        /**
         * Records sampled when enumerating target fields without an identifier
         */
        private int fieldSampleSize = 10;

        private Duration connectTimeout = Duration.ofSeconds(10);

        private Duration readTimeout = Duration.ofSeconds(30);

        public String getAdminBaseUrl() {
            String host = shopUrl.replaceFirst("^https?://", "").replaceAll("/+$", "");
            return "https://" + host + "/admin/api/" + apiVersion;
        }
    }

    @Data
    public static class Sync {
        /**
         * Ids fetched per listing request when collecting all source ids
         */
        private int listingPageSize = 500;

        /**
         * Items handed to one orchestrator call
         */
        private int batchSize = 50;

        /**
         * Items processed concurrently within one call
         */
        private int itemConcurrency = 4;

        /**
         * Sync-all jobs that may run at the same time
         */
        private int jobConcurrency = 2;

        /**
         * Sync-all jobs that may wait for a free job thread before new ones are refused
         */
        private int jobQueueCapacity = 10;

        /**
         * How long a finished sync-all job stays available for polling
         */
        private Duration jobRetention = Duration.ofHours(1);

        /**
         * Finished sync-all jobs kept at most; the oldest are dropped first
         */
        private int maxRetainedJobs = 100;
    }

    @Data
    public static class Mapping {
        /**
         * Version written to and expected in mapping export bundles
         */
        private String exportVersion = "1.0";

        /**
         * Natural-key source path overrides per entity type value
         */
        private Map<String, String> naturalKeys = new HashMap<>();
    }

    @Data
    public static class Transform {
        /**
         * Allow {@code custom} expression rules. Custom code is trusted input.
         */
        private boolean customExpressionsEnabled = true;
    }

    @Data
    public static class Events {
        private boolean enabled = true;

        private String exchange = "shop-sync.events";

        /**
         * Queue bound to every sync event, for monitoring consumers
         */
        private String queue = "shop-sync.progress";
    }

    @Data
    public static class Cache {
        private Duration fieldCatalogTtl = Duration.ofHours(1);
    }
}
