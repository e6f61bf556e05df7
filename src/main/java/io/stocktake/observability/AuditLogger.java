package io.stocktake.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.stocktake.util.Hashing;
import io.stocktake.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only JSONL audit trail. Each row carries the hash of the previous row so a
 * truncated or edited log is detectable with {@link #verify()}.
 *
 * <p>Several processes may share one log. Every append holds an exclusive file lock and
 * reads the previous hash from the end of the file, so the chain stays linear no matter
 * which writer got there first.
 */
public final class AuditLogger {
    private static final int TAIL_WINDOW = 8_192;
    // File locks are held per JVM, so writers in one process also queue on a monitor.
    private static final ConcurrentMap<Path, Object> WRITERS = new ConcurrentHashMap<>();

    private final Path auditFile;
    private final String namespace;
    private final Object writer;

    public AuditLogger(Path auditFile, String namespace) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
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
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.writer = WRITERS.computeIfAbsent(auditFile.toAbsolutePath().normalize(), p -> new Object());
    }

    public void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("result", event.result());
        row.put("session_id", event.sessionId());
        row.put("item_id", event.itemId());
        row.put("details", event.details());
        synchronized (writer) {
            try (FileChannel ch = openChannel(); FileLock ignored = ch.lock()) {
                row.put("prev_hash", lastHash(ch));
                String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
                row.put("hash", rowHash);
                ByteBuffer line = ByteBuffer.wrap(
                        (Jsons.toCompactJson(row) + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
                long position = ch.size();
                while (line.hasRemaining()) {
                    position += ch.write(line, position);
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to write audit log", e);
            }
        }
    }

    /** Hash of the last row on disk, or an empty string for an empty log. */
    public String currentHash() {
        synchronized (writer) {
            try (FileChannel ch = openChannel(); FileLock ignored = ch.lock()) {
                return lastHash(ch);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
            }
        }
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<JsonNode> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(1, limit));
        return new ArrayList<>(rows.subList(from, rows.size()));
    }

    /**
     * Recomputes the chain. Returns the number of rows verified, or throws when a row's
     * hash or back-link does not match.
     */
    @SuppressWarnings("unchecked")
    public synchronized int verify() {
        String expectedPrev = "";
        int verified = 0;
        for (JsonNode node : readRows()) {
            Map<String, Object> row = Jsons.mapper().convertValue(node, LinkedHashMap.class);
            Object storedHash = row.remove("hash");
            String prev = String.valueOf(row.getOrDefault("prev_hash", ""));
            if (!expectedPrev.equals(prev)) {
                throw new IllegalStateException("Audit chain broken at row " + (verified + 1) + ": prev_hash mismatch");
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(storedHash)) {
                throw new IllegalStateException("Audit chain broken at row " + (verified + 1) + ": hash mismatch");
            }
            expectedPrev = recomputed;
            verified++;
        }
        return verified;
    }

    private List<JsonNode> readRows() {
        List<JsonNode> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(Jsons.mapper().readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private FileChannel openChannel() throws IOException {
        return FileChannel.open(auditFile, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
    }

    /** Reads backwards from the end of the file, widening the window until it holds a whole row. */
    private static String lastHash(FileChannel ch) throws IOException {
        long size = ch.size();
        long window = TAIL_WINDOW;
        while (size > 0L) {
            long start = Math.max(0L, size - window);
            ByteBuffer buf = ByteBuffer.allocate((int) (size - start));
            long position = start;
            while (buf.hasRemaining()) {
                int read = ch.read(buf, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
            String text = new String(buf.array(), 0, buf.position(), StandardCharsets.UTF_8).stripTrailing();
            int newline = text.lastIndexOf('\n');
            if (!text.isEmpty() && (newline >= 0 || start == 0L)) {
                return Jsons.mapper().readTree(text.substring(newline + 1).trim()).path("hash").asText("");
            }
            if (start == 0L) {
                break;
            }
            window *= 2;
        }
        return "";
    }

    public record AuditEvent(
            String action,
            String actor,
            String result,
            String sessionId,
            String itemId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String result, String sessionId, Map<String, Object> details) {
            return new AuditEvent(action, actor, result, sessionId, null, details == null ? Map.of() : details);
        }

        public static AuditEvent ofItem(String action, String actor, String result, String sessionId, String itemId,
                                        Map<String, Object> details) {
            return new AuditEvent(action, actor, result, sessionId, itemId, details == null ? Map.of() : details);
        }
    }
}
