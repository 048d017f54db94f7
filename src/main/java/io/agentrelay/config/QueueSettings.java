package io.agentrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.agentrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables for polling, retry backoff and recovery.
 *
 * <p>Values come from {@code agentrelay-settings.json} under the runtime root when it
 * exists. Missing or out-of-range entries fall back to the defaults.
 */
public record QueueSettings(
        long pollIntervalMs,
        int defaultMaxRetries,
        long baseBackoffMs,
        long maxBackoffMs,
        long stuckTimeoutMs,
        long retentionHours,
        long stopTimeoutMs
) {
    public static QueueSettings defaults() {
        return new QueueSettings(
                AgentRelayConfig.DEFAULT_POLL_INTERVAL_MS,
                AgentRelayConfig.DEFAULT_MAX_RETRIES,
                AgentRelayConfig.DEFAULT_BASE_BACKOFF_MS,
                AgentRelayConfig.DEFAULT_MAX_BACKOFF_MS,
                AgentRelayConfig.DEFAULT_STUCK_TIMEOUT_MS,
                AgentRelayConfig.DEFAULT_RETENTION_HOURS,
                AgentRelayConfig.DEFAULT_STOP_TIMEOUT_MS
        );
    }

    public static QueueSettings load(AgentRelayConfig config) {
        return load(config.settingsFile());
    }

    public static QueueSettings load(Path settingsFile) {
        QueueSettings defaults = defaults();
        if (!Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load queue settings: " + settingsFile, e);
        }
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }

    public Duration stuckTimeout() {
        return Duration.ofMillis(stuckTimeoutMs);
    }

    public Duration stopTimeout() {
        return Duration.ofMillis(stopTimeoutMs);
    }

    static QueueSettings fromFile(SettingsFile file, QueueSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 0L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), 0L);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        return new QueueSettings(
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L),
                sanitizeInt(file.maxRetries(), defaults.defaultMaxRetries(), 0),
                baseBackoff,
                maxBackoff,
                sanitizeLong(file.stuckTimeoutMs(), defaults.stuckTimeoutMs(), 1_000L),
                sanitizeLong(file.retentionHours(), defaults.retentionHours(), 0L),
                sanitizeLong(file.stopTimeoutMs(), defaults.stopTimeoutMs(), 0L)
        );
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long pollIntervalMs,
            Integer maxRetries,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long stuckTimeoutMs,
            Long retentionHours,
            Long stopTimeoutMs
    ) {
    }
}
