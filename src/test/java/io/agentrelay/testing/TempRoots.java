package io.agentrelay.testing;

import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.config.QueueSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

public final class TempRoots {
    private TempRoots() {
    }

    public static Path create(String prefix) throws IOException {
        return Files.createTempDirectory("agentrelay-test-" + prefix + "-");
    }

    public static AgentRelayConfig config(Path root) {
        return AgentRelayConfig.fromRoot(root.toString());
    }

    /**
     * Settings with a short poll interval and no retry backoff.
     */
    public static QueueSettings fastSettings() {
        return new QueueSettings(20L, 3, 0L, 0L, 30L * 60L * 1000L, 24L, 5_000L);
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
