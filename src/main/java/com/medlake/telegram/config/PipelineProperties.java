package com.medlake.telegram.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Explicit pipeline configuration, bound from {@code app.*} and handed to each stage at construction.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class PipelineProperties {

    /** Channel handles to crawl, without the leading '@'. */
    @NotEmpty
    private List<String> channels = new ArrayList<>(List.of("lobelia4cosmetics", "tikvahpharma"));

    @Valid
    private final Crawler crawler = new Crawler();
    @Valid
    private final Lake lake = new Lake();
    @Valid
    private final Storage storage = new Storage();
    @Valid
    private final Enricher enricher = new Enricher();
    @Valid
    private final Detection detection = new Detection();
    @Valid
    private final Telegram telegram = new Telegram();

    @Data
    public static class Crawler {
        @Min(1)
        private int pageSize = 500;
        @NotNull
        private Duration lookback = Duration.ofDays(30);
        /** Number of channels crawled concurrently. */
        @Min(1)
        private int parallelism = 1;
        private int maxFetchAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Lake {
        @NotNull
        private String basePath = "data/raw/telegram_messages";
        private String imagesDir = "images";
        /** Zone used to derive the run-date of a batch. */
        private ZoneId zone = ZoneId.of("UTC");
    }

    @Data
    public static class Storage {
        private String schema = "raw";
        private StorageDialect dialect = StorageDialect.POSTGRES;
    }

    @Data
    public static class Enricher {
        /**
         * When true, assets that produced no detections are recorded as processed and not re-sent
         * to the detector on later runs.
         */
        private boolean rememberEmptyAssets = true;
    }

    @Data
    public static class Detection {
        private String provider = "rekognition";
        /** Model requested from the HTTP inference server and recorded in the processed-asset ledger. */
        private String modelName = "yolov8n";
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.25;
        private int maxLabels = 50;
        private int maxAttempts = 6;
        private Duration baseBackoff = Duration.ofMillis(800);
        private String baseUrl = "http://localhost:8500";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Telegram {
        private String gatewayUrl = "http://localhost:8088";
        private String apiId;
        private String apiHash;
        private String sessionName = "telegram_scraper_session";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }
}
