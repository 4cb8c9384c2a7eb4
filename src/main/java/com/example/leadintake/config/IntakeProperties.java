package com.example.leadintake.config;

import com.example.leadintake.model.FallbackPolicy;
import com.example.leadintake.model.LeadField;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Startup configuration for the intake pipeline, bound from {@code intake.*}.
 */
@Data
@ConfigurationProperties(prefix = "intake")
public class IntakeProperties {

    private Inbox inbox = new Inbox();
    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private Fallback fallback = new Fallback();
    private Sync sync = new Sync();

    @Data
    public static class Inbox {
        private String url = "https://grow.clio.com/inbox_leads";
        private String token = "";
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class RateLimit {
        private int maxRequests = 100;
        private Duration window = Duration.ofSeconds(60);
        // how long a caller may wait for a slot before giving up with RATE_LIMITED
        private Duration acquireTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(10);
        private boolean jitter = true;
        private Duration maxRetryAfter = Duration.ofSeconds(60);
        private Duration requestBudget = Duration.ofSeconds(120);
    }

    @Data
    public static class Fallback {
        private String firstName = "Unknown";
        private String lastName = "Contact";
        private String message = "Voice agent intake submission";
        private String email = "unknown@intake-system.local";
        private String phone = "0000000000";
        private String referringUrl = "https://intake-system.local";
        private String source = "Voice Agent Bot";

        public FallbackPolicy toPolicy() {
            Map<LeadField, String> defaults = new EnumMap<>(LeadField.class);
            defaults.put(LeadField.FIRST_NAME, firstName);
            defaults.put(LeadField.LAST_NAME, lastName);
            defaults.put(LeadField.MESSAGE, message);
            defaults.put(LeadField.EMAIL, email);
            defaults.put(LeadField.PHONE, phone);
            defaults.put(LeadField.REFERRING_URL, referringUrl);
            defaults.put(LeadField.SOURCE, source);
            return new FallbackPolicy(defaults);
        }
    }

    @Data
    public static class Sync {
        private String baseUrl = "https://app.clio.com";
        private String accessToken = "";
        private String apiVersion = "4.0.12";
        private int perPage = 50;
        private int maxPages = 1000;
        private Map<String, String> resources = new LinkedHashMap<>(Map.of(
                "contacts", "/api/v4/contacts.json",
                "custom_actions", "/api/v4/custom_actions.json",
                "webhook_subscriptions", "/api/v4/webhooks.json"));
        private Headers headers = new Headers();
    }

    /**
     * Pagination header names of the downstream API.
     */
    @Data
    public static class Headers {
        private String currentPage = "X-Current-Page";
        private String perPage = "X-Per-Page";
        private String totalCount = "X-Total-Count";
        private String totalPages = "X-Total-Pages";
        private String hasNextPage = "X-Has-Next-Page";
    }
}
