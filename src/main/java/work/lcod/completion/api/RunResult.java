package work.lcod.completion.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.completion.engine.CompletionReport;

/**
 * Outcome of a {@link CompletionRunner} run, shared by the CLI and embedding apps. The metadata holds the
 * {@code pipeline}, {@code attributes}, {@code parameters} and {@code issues} entries, or an {@code error}.
 */
public record RunResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * {@link Status#SUCCESS} when the report holds no issue, {@link Status#PARTIAL} otherwise.
     */
    public static RunResult completed(CompletionReport report, Map<String, Object> metadata, Instant startedAt) {
        var status = report.isComplete() ? Status.SUCCESS : Status.PARTIAL;
        return new RunResult(status, metadata, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new RunResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public RunResult withSerializedPayload(String payload) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("payload", payload);
        return new RunResult(status, meta, startedAt, finishedAt);
    }

    public List<?> issues() {
        return metadata.get("issues") instanceof List<?> issues ? issues : List.of();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        serializable.put("elapsedMs", elapsed().toMillis());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize run result", ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        PARTIAL(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
