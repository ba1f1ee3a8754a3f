package com.deepansh.chatagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for the built-in tools.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private WebSearch webSearch = new WebSearch();
    private FetchUrl fetchUrl = new FetchUrl();
    private SendMessages sendMessages = new SendMessages();

    @Data
    public static class WebSearch {
        private Brave brave = new Brave();

        @Data
        public static class Brave {
            private String apiKey = "";
            private String baseUrl = "https://api.search.brave.com/res/v1";
            private int maxResults = 5;
        }
    }

    @Data
    public static class FetchUrl {
        private int maxContentChars = 50_000;
        /** Comma-separated allowlist; empty means allow all */
        private String allowedDomains = "";

        public List<String> getAllowedDomainList() {
            if (allowedDomains == null || allowedDomains.isBlank()) return List.of();
            return Arrays.stream(allowedDomains.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }
    }

    @Data
    public static class SendMessages {
        private Duration baseDelay = Duration.ofMillis(800);
        private Duration perCharDelay = Duration.ofMillis(10);
        private Duration maxLengthBonus = Duration.ofMillis(1200);
    }
}
