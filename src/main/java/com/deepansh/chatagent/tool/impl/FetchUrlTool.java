package com.deepansh.chatagent.tool.impl;

import com.deepansh.chatagent.config.ToolProperties;
import com.deepansh.chatagent.tool.AgentTool;
import com.deepansh.chatagent.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fetches a web page and returns its readable text.
 *
 * Security controls:
 * - http / https only
 * - Domain allowlist: TOOL_FETCH_ALLOWED_DOMAINS (comma-separated), empty = allow all
 * - Content truncated at tools.fetch-url.max-content-chars
 */
@Component
@Slf4j
public class FetchUrlTool implements AgentTool {

    private final ToolProperties toolProperties;
    private final RestClient restClient;

    public FetchUrlTool(ToolProperties toolProperties,
                        @Qualifier("pooledRestClientBuilder") RestClient.Builder builder) {
        this.toolProperties = toolProperties;
        this.restClient = builder
                .defaultHeader("User-Agent", "Mozilla/5.0 (compatible; chat-task-agent)")
                .requestInterceptor((request, body, execution) -> {
                    log.debug("Outbound fetch: {} {}", request.getMethod(), request.getURI());
                    return execution.execute(request, body);
                })
                .build();
    }

    @Override
    public String getName() {
        return "fetch_url";
    }

    @Override
    public String getDescription() {
        return """
                Fetch a web page and return its readable text content.
                Use this to read an article, documentation page, or any URL the user mentions.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "url", Map.of(
                                "type", "string",
                                "description", "Full http(s) URL to fetch"
                        )
                ),
                "required", List.of("url")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, String chatId) {
        Object rawUrl = arguments.get("url");
        if (rawUrl == null || rawUrl.toString().isBlank()) {
            throw new IllegalArgumentException("'url' is required for fetch_url");
        }

        URI uri = validate(rawUrl.toString().trim());
        log.info("Fetching url={} [chat={}]", uri, chatId);

        String body = restClient.get().uri(uri).retrieve().body(String.class);
        if (body == null || body.isBlank()) {
            return ToolResult.text("Page at " + uri + " returned no content.");
        }

        String text = toReadableText(body);
        int max = toolProperties.getFetchUrl().getMaxContentChars();
        if (text.length() > max) {
            text = text.substring(0, max) + "\n...[truncated]";
        }
        return ToolResult.text("Content of " + uri + ":\n" + text);
    }

    URI validate(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("malformed URL '" + url + "'");
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("only http and https URLs are allowed");
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("URL has no host");
        }

        List<String> allowed = toolProperties.getFetchUrl().getAllowedDomainList();
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (!allowed.isEmpty() && allowed.stream().noneMatch(d -> host.equals(d) || host.endsWith("." + d))) {
            throw new IllegalArgumentException("domain '" + host + "' is not in the allowlist");
        }
        return uri;
    }

    /**
     * Page text, one line per block of the main content (main, else article,
     * else body). Scripts, styles and page chrome are dropped; entities are
     * decoded by the parser.
     */
    static String toReadableText(String html) {
        Document doc = Jsoup.parse(html);
        doc.select("script,noscript,style,template,header,footer,nav,aside").remove();

        Element root = doc.selectFirst("main");
        if (root == null) root = doc.selectFirst("article");
        if (root == null) root = doc.body();

        String text = root.children().stream()
                .map(Element::text)
                .map(FetchUrlTool::clean)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
        return text.isEmpty() ? clean(root.text()) : text;
    }

    private static String clean(String text) {
        return text.replace('\u00A0', ' ').strip();
    }
}
