package com.fieldforce.fieldexecutionbackend.config;

import com.fieldforce.fieldexecutionbackend.model.ActivityType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine tuning, adjustable through application.properties under {@code field-execution.*}.
 */
@Getter @Setter
@Configuration
@ConfigurationProperties(prefix = "field-execution")
public class FieldExecutionProperties {

    private Backend backend = new Backend();
    private Location location = new Location();
    private Progress progress = new Progress();

    // Used when the backend returns a visit without activity rows
    private List<ActivityTemplate> defaultActivities = new ArrayList<>(List.of(
            new ActivityTemplate("photos", ActivityType.PHOTO, "Take Photo", true),
            new ActivityTemplate("stock_opname", ActivityType.STOCK_CHECK, "Stock Opname", true),
            new ActivityTemplate("payment", ActivityType.PAYMENT, "Payment Collection", false),
            new ActivityTemplate("sales_order", ActivityType.ORDER, "Sales Order", false),
            new ActivityTemplate("competitor_survey", ActivityType.SURVEY, "Competitor Survey", false)
    ));

    @Getter @Setter
    public static class Backend {
        private String baseUrl = "http://localhost:8000";
        private String apiToken;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter @Setter
    public static class Location {
        // Check-in never waits longer than this for a fix
        private Duration captureTimeout = Duration.ofSeconds(5);
        // A device-reported position older than this counts as unknown
        private Duration maxAge = Duration.ofMinutes(2);
    }

    @Getter @Setter
    public static class Progress {
        private Duration redisTtl = Duration.ofDays(3);
    }

    @Getter @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActivityTemplate {
        private String key;
        private ActivityType type;
        private String name;
        private boolean mandatory;
    }
}
