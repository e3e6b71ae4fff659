package me.golemcore.warranty.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warranty.domain.model.LlmRequest;
import me.golemcore.warranty.domain.model.LlmResponse;
import me.golemcore.warranty.domain.model.LlmUsage;
import me.golemcore.warranty.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reasoning service adapter backed by langchain4j chat models. Models are
 * addressed as {@code provider/model}; {@code anthropic} uses the Anthropic
 * client, every other provider the OpenAI-compatible one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    /**
     * Max retry attempts for rate limit / transient errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    private final AgentProperties properties;

    private ChatModel chatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }

        String model = properties.getLlm().getLangchain4j().getModel();
        this.currentModel = model;

        try {
            this.chatModel = createModel(model);
            initialized = true;
            log.info("Langchain4j adapter initialized with model: {}", model);
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    String getProvider(String model) {
        return model != null && model.contains("/") ? model.substring(0, model.indexOf('/')) : PROVIDER_OPENAI;
    }

    private String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private AgentProperties.ProviderProperties getProviderConfig(String providerName) {
        AgentProperties.ProviderProperties config = properties.getLlm().getLangchain4j().getProviders()
                .get(providerName);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add agent.llm.langchain4j.providers." + providerName + ".api-key");
        }
        return config;
    }

    private ChatModel createModel(String model) {
        String provider = getProvider(model);
        AgentProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        AgentProperties.Langchain4jProperties settings = properties.getLlm().getLangchain4j();

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(settings.getMaxTokens())
                    .temperature(settings.getTemperature())
                    .timeout(Duration.ofMillis(settings.getTimeoutMs()));
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        // All non-Anthropic providers use OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(settings.getMaxTokens())
                .temperature(settings.getTemperature())
                .timeout(Duration.ofMillis(settings.getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }

            List<ChatMessage> messages = convertMessages(request);
            long started = System.nanoTime();

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(messages);
                    return convertResponse(response, Duration.ofNanos(System.nanoTime() - started));
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = computeBackoffMs(e, attempt);
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleepBeforeRetry(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed for run {}", request.getRunId(), e);
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    private long computeBackoffMs(Throwable e, int attempt) {
        long exponentialBackoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
        long resetSeconds = extractResetSeconds(e);
        return resetSeconds > 0
                ? Math.max(resetSeconds * 1000 + 1000, exponentialBackoffMs)
                : exponentialBackoffMs;
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    boolean isRateLimitError(Throwable e) {
        // Walk the cause chain looking for rate limit indicators
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Extract reset_seconds from rate limit error JSON body. Returns -1 if not
     * found.
     */
    long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        String userPrompt = request.getUserPrompt() != null ? request.getUserPrompt() : "";
        messages.add(UserMessage.from(userPrompt));
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, Duration latency) {
        AiMessage aiMessage = response.aiMessage();

        LlmUsage usage = null;
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = LlmUsage.builder()
                    .inputTokens(orZero(tokenUsage.inputTokenCount()))
                    .outputTokens(orZero(tokenUsage.outputTokenCount()))
                    .totalTokens(orZero(tokenUsage.totalTokenCount()))
                    .latency(latency)
                    .model(currentModel)
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .usage(usage)
                .model(currentModel)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private int orZero(Integer value) {
        return value != null ? value : 0;
    }

    @Override
    public String getCurrentModel() {
        return currentModel != null ? currentModel : properties.getLlm().getLangchain4j().getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getLangchain4j().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }
}
