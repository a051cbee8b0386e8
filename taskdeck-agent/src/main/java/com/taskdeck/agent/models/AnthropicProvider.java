package com.taskdeck.agent.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ModelProvider} over the Anthropic Messages API.
 *
 * <p>
 * Tool calls and tool results travel as content blocks: an assistant turn
 * carries {@code tool_use} blocks, and each result goes back as a user turn
 * with one {@code tool_result} block. Prompt-cache tokens are folded into
 * {@link ModelProvider.Usage#getCacheTokens()} so a run is charged for them.
 * </p>
 */
@Slf4j
public class AnthropicProvider implements ModelProvider {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    static final String API_VERSION = "2023-06-01";
    static final int DEFAULT_OUTPUT_TOKENS = 4096;

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final TypeReference<Map<String, Object>> INPUT_TYPE = new TypeReference<>() {
    };

    private final String apiKey;
    private final String messagesUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public AnthropicProvider(String apiKey, String baseUrl) {
        this(apiKey, baseUrl, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(30))
                .writeTimeout(Duration.ofSeconds(30))
                .readTimeout(Duration.ofMinutes(5))
                .build());
    }

    AnthropicProvider(String apiKey, String baseUrl, OkHttpClient httpClient) {
        String base = baseUrl != null && !baseUrl.isBlank() ? baseUrl : DEFAULT_BASE_URL;
        this.apiKey = apiKey;
        this.messagesUrl = (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/messages";
        this.httpClient = httpClient;
    }

    @Override
    public String getId() {
        return "anthropic";
    }

    @Override
    public CompletableFuture<ChatResponse> chat(ChatRequest request) {
        CompletableFuture<ChatResponse> result = new CompletableFuture<>();
        Request httpRequest;
        try {
            httpRequest = new Request.Builder()
                    .url(messagesUrl)
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .post(RequestBody.create(mapper.writeValueAsString(buildRequestBody(request)), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            result.completeExceptionally(e);
            return result;
        }

        httpClient.newCall(httpRequest).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody body = response.body()) {
                    String json = body != null ? body.string() : "";
                    if (!response.isSuccessful()) {
                        result.completeExceptionally(
                                new IOException("Anthropic API returned " + response.code() + ": " + json));
                        return;
                    }
                    ChatResponse parsed = parseResponse(json);
                    if ("max_tokens".equals(parsed.getStopReason())) {
                        log.warn("Run {}: model output truncated at {} tokens", request.getRunId(),
                                request.getMaxTokens());
                    }
                    result.complete(parsed);
                } catch (IOException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }

    Map<String, Object> buildRequestBody(ChatRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", stripProviderPrefix(request.getModel()));
        body.put("max_tokens", request.getMaxTokens() > 0 ? request.getMaxTokens() : DEFAULT_OUTPUT_TOKENS);
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            body.put("system", request.getSystemPrompt());
        }
        List<Map<String, Object>> messages = new ArrayList<>();
        for (ChatMessage message : request.getMessages()) {
            messages.add(encodeMessage(message));
        }
        body.put("messages", messages);
        if (request.getTools() != null && !request.getTools().isEmpty()) {
            body.put("tools", request.getTools());
        }
        return body;
    }

    private static Map<String, Object> encodeMessage(ChatMessage message) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        String content = message.getContent() != null ? message.getContent() : "";

        if (ChatMessage.TOOL.equals(message.getRole())) {
            encoded.put("role", ChatMessage.USER);
            encoded.put("content", List.of(Map.of(
                    "type", "tool_result",
                    "tool_use_id", message.getToolUseId(),
                    "content", content)));
            return encoded;
        }

        encoded.put("role", message.getRole());
        if (message.getToolUses() == null || message.getToolUses().isEmpty()) {
            encoded.put("content", content);
            return encoded;
        }
        List<Map<String, Object>> blocks = new ArrayList<>();
        if (!content.isEmpty()) {
            blocks.add(Map.of("type", "text", "text", content));
        }
        for (ToolUse use : message.getToolUses()) {
            blocks.add(Map.of(
                    "type", "tool_use",
                    "id", use.getId(),
                    "name", use.getName(),
                    "input", use.getInput() != null ? use.getInput() : Map.of()));
        }
        encoded.put("content", blocks);
        return encoded;
    }

    ChatResponse parseResponse(String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);

        StringBuilder text = new StringBuilder();
        List<ToolUse> toolUses = new ArrayList<>();
        for (JsonNode block : root.path("content")) {
            switch (block.path("type").asText()) {
                case "text" -> text.append(block.path("text").asText());
                case "tool_use" -> toolUses.add(ToolUse.builder()
                        .id(block.path("id").asText())
                        .name(block.path("name").asText())
                        .input(mapper.convertValue(block.path("input"), INPUT_TYPE))
                        .build());
                default -> log.debug("Ignoring content block of type {}", block.path("type").asText());
            }
        }

        JsonNode usage = root.path("usage");
        return ChatResponse.builder()
                .message(ChatMessage.assistant(text.toString(), null))
                .toolUses(toolUses.isEmpty() ? null : toolUses)
                .usage(Usage.builder()
                        .inputTokens(usage.path("input_tokens").asInt())
                        .outputTokens(usage.path("output_tokens").asInt())
                        .cacheTokens(usage.path("cache_creation_input_tokens").asInt()
                                + usage.path("cache_read_input_tokens").asInt())
                        .build())
                .stopReason(root.path("stop_reason").asText(null))
                .build();
    }

    /** "anthropic/claude-x" and "claude-x" name the same model. */
    static String stripProviderPrefix(String model) {
        int slash = model.indexOf('/');
        return slash >= 0 ? model.substring(slash + 1) : model;
    }
}
