package com.demo.churn.service.refresh;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the whole gate state as one JSON object. A missing, unreadable or
 * malformed file loads as an empty state so every target is due.
 */
@Slf4j
public class RefreshGateStateStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public RefreshGateStateStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public Path getFile() {
        return file;
    }

    public RefreshGateState load() {
        if (!Files.exists(file)) {
            return RefreshGateState.empty();
        }
        try {
            Map<String, Object> raw = objectMapper.readValue(file.toFile(), MAP_TYPE);
            if (raw == null) return RefreshGateState.empty();
            Map<String, String> runs = new LinkedHashMap<>();
            raw.forEach((k, v) -> {
                if (v instanceof String) runs.put(k, (String) v);
            });
            return RefreshGateState.of(runs);
        } catch (IOException | RuntimeException e) {
            log.warn("Refresh state {} is unreadable, treating as empty: {}", file, e.toString());
            return RefreshGateState.empty();
        }
    }

    /**
     * Writes the state to a sibling temp file and moves it over the target, so a crash
     * mid-write leaves the previous state intact.
     */
    public void save(RefreshGateState state) {
        Path target = file.toAbsolutePath();
        Path tmp = null;
        try {
            Path parent = target.getParent();
            if (parent != null) Files.createDirectories(parent);
            tmp = Files.createTempFile(parent, target.getFileName() + ".", ".tmp");
            objectMapper.writeValue(tmp.toFile(), state.asMap());
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Could not write refresh state " + file, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp state file {}: {}", tmp, e.toString());
        }
    }
}
