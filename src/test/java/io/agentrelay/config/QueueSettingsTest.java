package io.agentrelay.config;

import io.agentrelay.testing.TempRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

final class QueueSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = TempRoots.create("settings-missing");
        try {
            QueueSettings settings = QueueSettings.load(TempRoots.config(root));
            Assertions.assertEquals(QueueSettings.defaults(), settings);
            Assertions.assertEquals(Duration.ofSeconds(1), settings.pollInterval());
            Assertions.assertEquals(Duration.ofMinutes(30), settings.stuckTimeout());
            Assertions.assertEquals(3, settings.defaultMaxRetries());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void fileOverridesSelectedValues() throws Exception {
        Path root = TempRoots.create("settings-override");
        try {
            AgentRelayConfig config = TempRoots.config(root);
            Files.writeString(config.settingsFile(),
                    "{\"pollIntervalMs\":250,\"maxRetries\":5,\"stuckTimeoutMs\":60000,\"unrelated\":true}",
                    StandardCharsets.UTF_8);

            QueueSettings settings = QueueSettings.load(config);
            Assertions.assertEquals(250L, settings.pollIntervalMs());
            Assertions.assertEquals(5, settings.defaultMaxRetries());
            Assertions.assertEquals(Duration.ofMinutes(1), settings.stuckTimeout());
            Assertions.assertEquals(AgentRelayConfig.DEFAULT_BASE_BACKOFF_MS, settings.baseBackoffMs());
            Assertions.assertEquals(AgentRelayConfig.DEFAULT_RETENTION_HOURS, settings.retentionHours());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void outOfRangeValuesFallBack() {
        QueueSettings settings = QueueSettings.fromFile(
                new QueueSettings.SettingsFile(1L, -1, -5L, null, 10L, -1L, null),
                QueueSettings.defaults());
        Assertions.assertEquals(QueueSettings.defaults(), settings);
    }

    @Test
    void maxBackoffIsRaisedToBase() {
        QueueSettings settings = QueueSettings.fromFile(
                new QueueSettings.SettingsFile(null, null, 5_000L, 2_000L, null, null, null),
                QueueSettings.defaults());
        Assertions.assertEquals(5_000L, settings.baseBackoffMs());
        Assertions.assertEquals(5_000L, settings.maxBackoffMs());
    }

    @Test
    void unreadableFileIsAnError() throws Exception {
        Path root = TempRoots.create("settings-broken");
        try {
            AgentRelayConfig config = TempRoots.config(root);
            Files.writeString(config.settingsFile(), "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> QueueSettings.load(config));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }
}
