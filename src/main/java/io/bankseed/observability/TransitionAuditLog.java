package io.bankseed.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bankseed.util.Hashing;
import io.bankseed.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tamper-evident JSON-lines record of task transitions. Each row carries the hash of the
 * previous row, so editing or dropping a line breaks the chain from that point on.
 */
public final class TransitionAuditLog {
    private static final Logger logger = LogManager.getLogger(TransitionAuditLog.class);

    private final Path auditFile;
    private String previousHash;

    public TransitionAuditLog(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(String action, String taskId, String result, Map<String, Object> details) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", action);
        row.put("task_id", taskId);
        row.put("result", result);
        row.put("details", details == null ? Map.of() : details);
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public List<JsonNode> tail(int lines) {
        List<JsonNode> out = new ArrayList<>();
        List<String> all = readLines();
        int from = Math.max(0, all.size() - Math.max(1, lines));
        for (String line : all.subList(from, all.size())) {
            try {
                out.add(Jsons.mapper().readTree(line));
            } catch (IOException e) {
                logger.warn("Skipping unreadable audit line: {}", e.getMessage());
            }
        }
        return out;
    }

    /**
     * Rows whose action equals {@code action}, oldest first.
     */
    public List<JsonNode> find(String action, String taskId) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode row : tail(Integer.MAX_VALUE)) {
            if (action.equals(row.path("action").asText())
                    && (taskId == null || taskId.equals(row.path("task_id").asText()))) {
                out.add(row);
            }
        }
        return out;
    }

    public IntegrityReport verify() {
        List<String> lines = readLines();
        String expectedPrev = "";
        int checked = 0;
        for (int i = 0; i < lines.size(); i++) {
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(lines.get(i));
            } catch (IOException e) {
                return new IntegrityReport(false, checked, i + 1, "invalid_json");
            }
            String hash = parsed.path("hash").asText("");
            if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                return new IntegrityReport(false, checked, i + 1, "prev_hash_mismatch");
            }
            ObjectNode canonical = parsed.deepCopy();
            canonical.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                return new IntegrityReport(false, checked, i + 1, "hash_mismatch");
            }
            expectedPrev = hash;
            checked++;
        }
        return new IntegrityReport(true, checked, 0, "");
    }

    private List<String> readLines() {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(lines.get(lines.size() - 1)).path("hash").asText("");
        } catch (IOException e) {
            logger.warn("Last audit line unreadable, starting a new chain: {}", e.getMessage());
            return "";
        }
    }

    public record IntegrityReport(boolean valid, int checkedRows, int brokenLine, String reason) {
    }
}
