package work.lcod.specdoc.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Outcome of a {@link SpecDocRunner} execution (usable by the CLI and embedding apps). The metadata
 * map is what the CLI prints; the typed accessors read the keys the runner fills in.
 */
public record RunResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    static final String OUTPUT = "output";
    static final String SECTIONS = "sections";
    static final String WARNINGS = "warnings";
    static final String CODE = "code";
    static final String CHAPTER = "chapter";
    static final String CHAPTER_INDEX = "chapterIndex";
    static final String ERROR = "error";

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult success(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent(ERROR, message);
        return new RunResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public Optional<Path> output() {
        return Optional.ofNullable(metadata.get(OUTPUT)).map(value -> Path.of(value.toString()));
    }

    /**
     * Number of document sections written, one more than the page breaks. Empty on failure.
     */
    public OptionalLong sections() {
        return metadata.get(SECTIONS) instanceof Number count ? OptionalLong.of(count.longValue()) : OptionalLong.empty();
    }

    public List<String> warnings() {
        if (metadata.get(WARNINGS) instanceof List<?> list) {
            return list.stream().map(value -> String.valueOf(value)).toList();
        }
        return List.of();
    }

    /**
     * Failure code such as {@code authoring_error}; empty for a successful run.
     */
    public Optional<String> errorCode() {
        return Optional.ofNullable(metadata.get(CODE)).map(Object::toString);
    }

    public Optional<String> failedChapter() {
        return Optional.ofNullable(metadata.get(CHAPTER)).map(Object::toString);
    }

    public OptionalInt failedChapterIndex() {
        return metadata.get(CHAPTER_INDEX) instanceof Number index ? OptionalInt.of(index.intValue()) : OptionalInt.empty();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
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
