package com.parley.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * JSON state files under the data directory.
 *
 * <p>Whole-file state is written to a temp file and moved into place so a crash never leaves a
 * half-written file. Journals are append-only JSON lines; an unreadable line is skipped.
 */
public class StateFiles {

    private static final Logger log = LoggerFactory.getLogger(StateFiles.class);

    private final ObjectMapper objectMapper;
    private final Path dataDir;

    public StateFiles(ObjectMapper objectMapper, Path dataDir) {
        this.objectMapper = objectMapper;
        this.dataDir = dataDir;
    }

    public Path resolve(String name) {
        return dataDir.resolve(name);
    }

    public <T> T read(String name, TypeReference<T> type, Supplier<T> fallback) {
        Path file = resolve(name);
        if (!Files.isRegularFile(file)) {
            return fallback.get();
        }
        try {
            T value = objectMapper.readValue(file.toFile(), type);
            return value != null ? value : fallback.get();
        } catch (IOException e) {
            log.error("Could not read state file {}, starting from empty state: {}", file, e.getMessage());
            return fallback.get();
        }
    }

    public void write(String name, Object value) {
        Path file = resolve(name);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write state file " + file, e);
        }
    }

    public void append(String name, Object value) {
        Path file = resolve(name);
        try {
            Files.createDirectories(file.getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(objectMapper.writeValueAsString(value));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + file, e);
        }
    }

    public <T> List<T> readLines(String name, Class<T> type) {
        Path file = resolve(name);
        var result = new ArrayList<T>();
        if (!Files.isRegularFile(file)) {
            return result;
        }
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) continue;
                try {
                    result.add(objectMapper.readValue(line, type));
                } catch (IOException e) {
                    log.warn("Skipping unreadable line in {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        return result;
    }

    public List<String> list(String directory, String suffix) {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (var stream = Files.list(dir)) {
            return stream.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(suffix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }
}
