package com.sommerph.attestbackend.repository.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.*;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class JsonFileLedgerStateRegistry implements LedgerStateRegistry {

    private final Path storageDir;
    private final ObjectMapper mapper;

    public JsonFileLedgerStateRegistry(String path) throws IOException {
        this.storageDir = Paths.get(path);
        Files.createDirectories(storageDir);
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public void save(String unitId, Object state) {
        saveAll(Map.of(unitId, state));
    }

    // Every temp file is written before any state file is replaced
    @Override
    public void saveAll(Map<String, Object> states) {
        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, Object> entry : states.entrySet()) {
                Path tmpPath = storageDir.resolve(entry.getKey() + "-state.json.tmp");
                staged.put(tmpPath, resolve(entry.getKey()));
                mapper.writeValue(tmpPath.toFile(), entry.getValue());
            }
        } catch (IOException e) {
            log.error("Failed to stage state of units: {}", states.keySet(), e);
            discard(staged.keySet());
            throw new RuntimeException("Failed to save state of units: " + states.keySet(), e);
        }
        try {
            for (Map.Entry<Path, Path> move : staged.entrySet()) {
                Files.move(move.getKey(), move.getValue(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            log.debug("Wrote state of units {} to {}", states.keySet(), storageDir);
        } catch (IOException e) {
            log.error("Failed to replace state files of units: {}", states.keySet(), e);
            discard(staged.keySet());
            throw new RuntimeException("Failed to save state of units: " + states.keySet(), e);
        }
    }

    @Override
    public <S> S load(String unitId, Class<S> type) {
        Path filePath = resolve(unitId);
        if (!Files.exists(filePath)) {
            return null;
        }
        try {
            return mapper.readValue(filePath.toFile(), type);
        } catch (IOException e) {
            log.error("Failed to load state of unit: {}", unitId, e);
            throw new RuntimeException("Failed to load state of unit: " + unitId, e);
        }
    }

    @Override
    public boolean exists(String unitId) {
        return Files.exists(resolve(unitId));
    }

    private void discard(Iterable<Path> tmpPaths) {
        for (Path tmpPath : tmpPaths) {
            try {
                Files.deleteIfExists(tmpPath);
            } catch (IOException e) {
                log.warn("Could not remove temp file {}", tmpPath, e);
            }
        }
    }

    // File naming convention is <unitId>-state.json
    private Path resolve(String unitId) {
        return storageDir.resolve(unitId + "-state.json");
    }

}
