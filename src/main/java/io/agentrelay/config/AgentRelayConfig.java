package io.agentrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AgentRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_POLL_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_STUCK_TIMEOUT_MS = 30L * 60L * 1000L;
    public static final long DEFAULT_RETENTION_HOURS = 24L;
    public static final long DEFAULT_STOP_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 5_000L;

    private final Path rootDir;

    public AgentRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AgentRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new AgentRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("agentrelay.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve("agentrelay-settings.json");
    }
}
