package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    int contextWindowSize,
    int maxEntities,
    int recentEntityLimit,
    int topicHistoryLimit,
    int autoCompressAt,
    int compressEvery,
    long responseTimeoutMs,
    long compressTimeoutMs,
    String systemPromptOverride,
    boolean fallbackActionsEnabled
) {

    public static EngineConfig defaults() {
        return new EngineConfig(
            20,
            200,
            15,
            5,
            30,
            10,
            60_000,
            30_000,
            null,
            true
        );
    }

    @JsonIgnore
    public Duration responseTimeout() {
        return Duration.ofMillis(Math.max(1, responseTimeoutMs));
    }

    @JsonIgnore
    public Duration compressTimeout() {
        return Duration.ofMillis(Math.max(1, compressTimeoutMs));
    }
}
