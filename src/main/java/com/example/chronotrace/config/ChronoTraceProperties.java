package com.example.chronotrace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Application settings bound from {@code chronotrace.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "chronotrace")
public class ChronoTraceProperties {

    private EmbeddingConfig embedding = new EmbeddingConfig();
    private SearchConfig search = new SearchConfig();
    private IndexConfig index = new IndexConfig();
    private IngestConfig ingest = new IngestConfig();
    private TrackingConfig tracking = new TrackingConfig();
    private AnomalyConfig anomaly = new AnomalyConfig();

    @Data
    public static class EmbeddingConfig {
        private String type = "local";
        private int dimension = 256;
        private Duration segmentTtl = Duration.ofDays(7);
        private Duration queryTtl = Duration.ofHours(1);
        private long maxEntries = 100_000L;
        private int concurrency = 4;
        private Duration callTimeout = Duration.ofSeconds(30);
        private RetryConfig retry = new RetryConfig();
        private HttpConfig http = new HttpConfig();

        @Data
        public static class RetryConfig {
            private int maxAttempts = 4;
            private Duration initialBackoff = Duration.ofMillis(500);
            private double multiplier = 2.0;
        }

        @Data
        public static class HttpConfig {
            private String url;
            private String apiKey;
            private String model = "video-embed-v1";
        }
    }

    @Data
    public static class SearchConfig {
        private Duration resultTtl = Duration.ofHours(1);
        private long maxCachedResults = 10_000L;
        private int defaultTopK = 10;
        private int maxTopK = 100;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class IndexConfig {
        private int maxItems = 100_000;
        private int exactSearchThreshold = 2000;
        private boolean rebuildOnStartup = true;
    }

    @Data
    public static class IngestConfig {
        private Duration retryInterval = Duration.ofSeconds(30);
        private int maxQueuedRetries = 10_000;
        // contentPath uploads resolve below this directory; unset disables them
        private String segmentRoot;
    }

    @Data
    public static class TrackingConfig {
        private double similarityThreshold = 0.8;
        private double maxSpeed = 10.0;
        private Duration handoffMaxDelay = Duration.ofSeconds(30);
        private Duration closeTimeout = Duration.ofSeconds(60);
        private Duration reorderGrace = Duration.ofSeconds(5);
        // closed tracks, stationary objects and segments older than this leave the live stream state
        private Duration retention = Duration.ofMinutes(30);
    }

    @Data
    public static class AnomalyConfig {
        private LoiteringConfig loitering = new LoiteringConfig();
        private CrowdConfig crowd = new CrowdConfig();
        private AbandonmentConfig abandonment = new AbandonmentConfig();
        private OperatingHoursConfig operatingHours = new OperatingHoursConfig();
        private MovementConfig movement = new MovementConfig();

        @Data
        public static class LoiteringConfig {
            private double radius = 5.0;
            private double baselineMultiple = 5.0;
            private Duration absoluteFloor = Duration.ofMinutes(15);
            private Duration recentWindow = Duration.ofMinutes(10);
            private int baselineWindow = 50;
        }

        @Data
        public static class CrowdConfig {
            private int threshold = 10;
            private int minSurge = 5;
            private Duration window = Duration.ofSeconds(60);
        }

        @Data
        public static class AbandonmentConfig {
            private double distanceThreshold = 10.0;
            private Duration duration = Duration.ofMinutes(2);
        }

        @Data
        public static class OperatingHoursConfig {
            /** HH:mm, local to {@code zone} */
            private String start = "06:00";
            private String end = "22:00";
            private String zone = "UTC";
        }

        @Data
        public static class MovementConfig {
            private double sigma = 3.0;
            private int minSamples = 20;
        }
    }
}
