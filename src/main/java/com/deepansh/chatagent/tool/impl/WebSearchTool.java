package com.deepansh.chatagent.tool.impl;

import com.deepansh.chatagent.config.ToolProperties;
import com.deepansh.chatagent.tool.AgentTool;
import com.deepansh.chatagent.tool.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Web search tool powered by the Brave Search API.
 *
 * Output format: numbered list of results with title, URL, and snippet,
 * kept plain so it folds into the session context without markup.
 *
 * topic "news" goes to the news endpoint; everything else is a web search.
 */
@Component
@Slf4j
public class WebSearchTool implements AgentTool {

    private final ToolProperties toolProperties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public WebSearchTool(ToolProperties toolProperties,
                         ObjectMapper objectMapper,
                         @Qualifier("pooledRestClientBuilder") RestClient.Builder builder) {
        this.toolProperties = toolProperties;
        this.objectMapper = objectMapper;
        this.restClient = builder
                .baseUrl(toolProperties.getWebSearch().getBrave().getBaseUrl())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Override
    public String getName() {
        return "web_search";
    }

    @Override
    public String getDescription() {
        return """
                Search the web for current information, news, articles, or any topic.
                Returns the top results with titles, URLs, and summaries.
                Use this for current events or facts that may have changed recently.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "The search query. Be specific for better results."
                        ),
                        "topic", Map.of(
                                "type", "string",
                                "enum", List.of("web", "news"),
                                "description", "Where to search. Default: web"
                        ),
                        "count", Map.of(
                                "type", "integer",
                                "description", "Number of results to return (1-10). Default: 5"
                        )
                ),
                "required", List.of("query")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, String chatId) throws Exception {
        String apiKey = toolProperties.getWebSearch().getBrave().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Brave Search API key not configured (BRAVE_API_KEY)");
        }

        Object rawQuery = arguments.get("query");
        if (rawQuery == null || rawQuery.toString().isBlank()) {
            throw new IllegalArgumentException("'query' is required for web_search");
        }
        String query = rawQuery.toString();
        boolean news = "news".equals(arguments.get("topic"));
        int count = resolveCount(arguments.get("count"));

        log.info("Web search: query='{}' topic={} count={} [chat={}]", query, news ? "news" : "web", count, chatId);

        String url = UriComponentsBuilder.fromPath(news ? "/news/search" : "/web/search")
                .queryParam("q", query)
                .queryParam("count", count)
                .queryParam("text_decorations", false)
                .build()
                .toUriString();

        String responseBody = restClient.get()
                .uri(url)
                .header("X-Subscription-Token", apiKey)
                .retrieve()
                .body(String.class);

        return ToolResult.text(parseResults(responseBody, query, news));
    }

    String parseResults(String responseBody, String query, boolean news) throws Exception {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode results = news ? root.path("results") : root.path("web").path("results");

        if (results.isMissingNode() || !results.isArray() || results.isEmpty()) {
            return "No results found for: " + query;
        }

        List<String> formatted = new ArrayList<>();
        int index = 1;

        for (JsonNode result : results) {
            String title       = result.path("title").asText("No title");
            String url         = result.path("url").asText("");
            String description = result.path("description").asText("No description");

            formatted.add(String.format("""
                    [%d] %s
                         URL: %s
                         %s""", index++, title, url, description));
        }

        return "Search results for \"" + query + "\":\n\n" + String.join("\n\n", formatted);
    }

    private int resolveCount(Object raw) {
        int fallback = toolProperties.getWebSearch().getBrave().getMaxResults();
        if (raw == null) return fallback;
        try {
            int val = (int) Double.parseDouble(raw.toString());
            return Math.min(Math.max(val, 1), 10);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
