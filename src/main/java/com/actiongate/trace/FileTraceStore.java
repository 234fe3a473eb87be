package com.actiongate.trace;

import com.actiongate.audit.ArtifactHasher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Trace store laid out as {@code <dir>/runs/<runId>/trace.jsonl} and
 * {@code <dir>/runs/<runId>/artifacts/<name>.json}.
 *
 * Appends to one run are serialized by the lock stripe its run id hashes to. The stripe set is
 * fixed, so lock memory does not grow with the number of runs.
 */
public class FileTraceStore implements TraceStore {

    private static final Logger log = LoggerFactory.getLogger(FileTraceStore.class);
    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");
    private static final int LOCK_STRIPES = 32;

    private final Path baseDir;
    private final ObjectMapper mapper;
    private final Object[] runLocks = new Object[LOCK_STRIPES];

    public FileTraceStore(Path baseDir, ObjectMapper mapper) {
        this.baseDir = baseDir;
        this.mapper = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
        for (int i = 0; i < runLocks.length; i++) {
            runLocks[i] = new Object();
        }
    }

    @Override
    public void emit(TraceEvent event) {
        Path file = runDir(event.runId()).resolve("trace.jsonl");
        String line;
        try {
            line = mapper.writeValueAsString(event) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("trace event is not serializable: " + event.type(), ex);
        }
        synchronized (lockFor(event.runId())) {
            try {
                Files.createDirectories(file.getParent());
                Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.SYNC);
            } catch (IOException ex) {
                throw new UncheckedIOException("failed to append trace event to " + file, ex);
            }
        }
    }

    @Override
    public ArtifactRef writeArtifact(String runId, String name, Object content) {
        Path dir = runDir(runId).resolve("artifacts");
        Path file = dir.resolve(safe(name) + ".json");
        try {
            byte[] bytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(content);
            synchronized (lockFor(runId)) {
                Files.createDirectories(dir);
                Path tmp = Files.createTempFile(dir, name, ".tmp");
                Files.write(tmp, bytes);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            String relative = baseDir.relativize(file).toString().replace('\\', '/');
            return new ArtifactRef(name, relative, ArtifactHasher.sha256Hex(bytes), bytes.length);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to write artifact " + file, ex);
        }
    }

    @Override
    public boolean runExists(String runId) {
        return isSafe(runId) && Files.isDirectory(runDir(runId));
    }

    @Override
    public List<TraceEvent> loadRunEvents(String runId) {
        if (!isSafe(runId)) {
            return List.of();
        }
        Path file = runDir(runId).resolve("trace.jsonl");
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        synchronized (lockFor(runId)) {
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("failed to read " + file, ex);
            }
        }
        List<TraceEvent> events = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(mapper.readValue(line, TraceEvent.class));
            } catch (JsonProcessingException ex) {
                log.warn("Skipping unreadable trace line in run={}: {}", runId, ex.getOriginalMessage());
            }
        }
        return events;
    }

    @Override
    public List<String> listRuns() {
        Path runs = baseDir.resolve("runs");
        if (!Files.isDirectory(runs)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(runs)) {
            return stream
                .filter(Files::isDirectory)
                .sorted(Comparator.comparing(FileTraceStore::modifiedAt).reversed())
                .map(p -> p.getFileName().toString())
                .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to list runs under " + runs, ex);
        }
    }

    @Override
    public Optional<JsonNode> loadArtifact(String runId, String name) {
        if (!isSafe(runId) || !isSafe(name)) {
            return Optional.empty();
        }
        Path file = runDir(runId).resolve("artifacts").resolve(name + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(file.toFile()));
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read artifact " + file, ex);
        }
    }

    @Override
    public List<String> listArtifacts(String runId) {
        Path dir = runDir(runId).resolve("artifacts");
        if (!isSafe(runId) || !Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                .map(p -> p.getFileName().toString())
                .filter(n -> n.endsWith(".json"))
                .map(n -> n.substring(0, n.length() - ".json".length()))
                .sorted()
                .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to list artifacts under " + dir, ex);
        }
    }

    private Path runDir(String runId) {
        return baseDir.resolve("runs").resolve(safe(runId));
    }

    private Object lockFor(String runId) {
        return runLocks[Math.floorMod(runId.hashCode(), runLocks.length)];
    }

    private static boolean isSafe(String segment) {
        return segment != null && SAFE_SEGMENT.matcher(segment).matches() && !segment.startsWith(".");
    }

    private static String safe(String segment) {
        if (!isSafe(segment)) {
            throw new IllegalArgumentException("unsafe path segment: " + segment);
        }
        return segment;
    }

    private static FileTime modifiedAt(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException ex) {
            return FileTime.fromMillis(0);
        }
    }
}
