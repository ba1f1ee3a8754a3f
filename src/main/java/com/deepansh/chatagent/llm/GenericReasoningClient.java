package com.deepansh.chatagent.llm;

import com.deepansh.chatagent.exception.ReasoningException;
import com.deepansh.chatagent.model.Message;
import com.deepansh.chatagent.model.ToolInvocation;
import com.deepansh.chatagent.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client that works with Groq, OpenAI, and Gemini.
 *
 * Error handling strategy:
 *
 * | Error                  | Thrown                 | Circuit breaker |
 * |------------------------|------------------------|-----------------|
 * | 401 / other 4xx        | ReasoningException     | ignored         |
 * | 429 rate limit         | RuntimeException       | counted         |
 * | 5xx server error       | RuntimeException       | counted         |
 * | network error          | ResourceAccessException| counted         |
 * | malformed arguments    | ReasoningException     | ignored         |
 *
 * Whatever is thrown, the orchestrator fails the session: nothing here retries.
 */
@Slf4j
public class GenericReasoningClient implements ReasoningClient {

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericReasoningClient(LlmProviderProperties props,
                                  ObjectMapper objectMapper,
                                  String providerName,
                                  RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public ReasoningResponse reason(ReasoningRequest request) {
        Map<String, Object> requestBody = buildRequestBody(request);

        log.debug("Sending {} messages and {} tools to {} [model={}]",
                request.messages().size(), request.tools().size(), providerName, props.getModel());

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                    int status = res.getStatusCode().value();
                    if (status == 429) {
                        throw new RuntimeException(providerName + " rate limit exceeded");
                    }
                    if (status == 401) {
                        throw new ReasoningException(providerName + " API key is invalid. Check your "
                                + providerName.toUpperCase() + "_API_KEY environment variable.");
                    }
                    throw new ReasoningException(providerName + " client error [" + status + "]: " + body);
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                    throw new RuntimeException(
                            providerName + " server error [" + res.getStatusCode() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        if (response == null) {
            throw new ReasoningException(providerName + " returned an empty body");
        }
        return parseResponse(response);
    }

    private Map<String, Object> buildRequestBody(ReasoningRequest request) {
        List<Map<String, Object>> formattedMessages = request.messages().stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (!request.tools().isEmpty()) {
            body.put("tools", request.tools().stream().map(ToolDefinition::toFunctionSchema).toList());
            body.put("tool_choice", props.getToolChoice());
        }

        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());
        m.put("content", msg.getContent() != null ? msg.getContent() : "");
        return m;
    }

    @SuppressWarnings("unchecked")
    ReasoningResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ReasoningException(providerName + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        if (message == null) {
            throw new ReasoningException(providerName + " choice carried no message");
        }

        // Keyed on the tool_calls array rather than finish_reason: some providers
        // report "stop" even when they return calls.
        List<Map<String, Object>> rawCalls = (List<Map<String, Object>>) message.get("tool_calls");
        List<ToolInvocation> calls = new ArrayList<>();
        if (rawCalls != null) {
            for (Map<String, Object> raw : rawCalls) {
                calls.add(parseToolCall(raw));
            }
        }

        return ReasoningResponse.builder()
                .content((String) message.get("content"))
                .toolCalls(calls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    @SuppressWarnings("unchecked")
    private ToolInvocation parseToolCall(Map<String, Object> raw) {
        Map<String, Object> function = (Map<String, Object>) raw.get("function");
        if (function == null || function.get("name") == null) {
            throw new ReasoningException(providerName + " tool call without a function name");
        }

        Object rawArgs = function.get("arguments");
        Map<String, Object> args;
        try {
            if (rawArgs == null || rawArgs.toString().isBlank()) {
                args = Map.of();
            } else if (rawArgs instanceof Map<?, ?> map) {
                args = (Map<String, Object>) map;
            } else {
                args = objectMapper.readValue(rawArgs.toString(), new TypeReference<>() {});
            }
        } catch (JsonProcessingException e) {
            throw new ReasoningException("Failed to parse arguments for tool " + function.get("name"), e);
        }

        return ToolInvocation.builder()
                .id((String) raw.get("id"))
                .name((String) function.get("name"))
                .arguments(args)
                .build();
    }
}
