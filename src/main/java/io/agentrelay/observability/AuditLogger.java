package io.agentrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentrelay.security.SensitiveDataMasker;
import io.agentrelay.util.Hashing;
import io.agentrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines record of queue and workflow events.
 *
 * <p>Each row carries the hash of the previous row, so truncation or in-place edits break
 * the chain and are detected by {@link #verifyChain()}.
 */
public final class AuditLogger implements QueueEventListener {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    LOG.debug("Audit log {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    @Override
    public synchronized void onEvent(QueueEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", (event.at() == null ? Instant.now() : event.at()).toString());
        row.put("event", event.type());
        row.put("task_id", event.taskId());
        row.put("agent", event.agentType());
        row.put("operation", event.operation());
        row.put("message", event.message());
        row.put("details", SensitiveDataMasker.mask(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Re-hashes every row and checks that each one links to its predecessor.
     */
    @SuppressWarnings("unchecked")
    public synchronized boolean verifyChain() {
        try {
            String expectedPrev = "";
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (String line : lines) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrev.equals(row.get("prev_hash"))) {
                    return false;
                }
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!recomputed.equals(hash)) {
                    return false;
                }
                expectedPrev = recomputed;
            }
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            LOG.warn("Audit log {} has an unreadable tail, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }
}
