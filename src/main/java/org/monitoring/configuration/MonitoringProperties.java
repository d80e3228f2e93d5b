package org.monitoring.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binding for the {@code monitoring.*} properties.
 *
 * <pre>
 * monitoring:
 *   ingestion:
 *     batch-size: 500
 *     rejection-threshold: 0.5
 *     max-row-errors: 100
 *     zone: UTC
 *     stale-after: 30m
 *     timestamp-formats: ISO_DATE_TIME, ISO_DATE, yyyy-MM-dd HH:mm:ss
 *   inference:
 *     provider: auto
 *     sample-rows: 10
 *     timeout: 30s
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "monitoring")
public class MonitoringProperties {

    @NestedConfigurationProperty
    private Ingestion ingestion = new Ingestion();

    @NestedConfigurationProperty
    private Inference inference = new Inference();

    @Data
    public static class Ingestion {
        private int batchSize = 500;

        /** Fraction of rejected rows at or above which the whole ingestion fails. */
        private double rejectionThreshold = 0.5;

        private int maxRowErrors = 100;

        private String zone = "UTC";

        private Duration staleAfter = Duration.ofMinutes(30);

        private List<String> timestampFormats = new ArrayList<>(List.of(
                "ISO_DATE_TIME",
                "ISO_DATE",
                "yyyy-MM-dd HH:mm:ss",
                "yyyy-MM-dd HH:mm",
                "yyyy/MM/dd HH:mm:ss",
                "yyyy/MM/dd",
                "dd/MM/yyyy HH:mm",
                "dd/MM/yyyy",
                "dd-MM-yyyy",
                "dd.MM.yyyy"
        ));

        private boolean acceptEpoch = true;
    }

    @Data
    public static class Inference {
        /** {@code auto} uses a chat model when one is configured, {@code heuristic} never does. */
        private String provider = "auto";

        private int sampleRows = 10;

        private Duration timeout = Duration.ofSeconds(30);

        private int threads = 4;
    }
}
