package com.bsl.dimrank.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chunk store backed by a JSON file keyed by chunk id. The file is re-read when it changes,
 * at most once per {@code chunk-store.refresh-ms}.
 */
@Component
public class LocalChunkStoreClient implements ChunkStoreClient {
    private static final Logger log = LoggerFactory.getLogger(LocalChunkStoreClient.class);
    private final ChunkStoreProperties properties;
    private final ObjectMapper objectMapper;
    private volatile Map<String, ChunkRecord> chunks = Collections.emptyMap();
    private volatile long lastLoadedAt = 0L;
    private volatile long lastModified = 0L;

    public LocalChunkStoreClient(ChunkStoreProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, DimensionScore> getDimensionScores(String chunkId) {
        ChunkRecord record = find(chunkId);
        return record == null ? Map.of() : record.getDimensionScores();
    }

    @Override
    public double getRecency(String chunkId) {
        ChunkRecord record = find(chunkId);
        return record == null ? 0.0 : record.getRecencyScore();
    }

    @Override
    public double getConfidence(String chunkId) {
        ChunkRecord record = find(chunkId);
        return record == null ? 0.0 : record.getConfidenceScore();
    }

    public Collection<ChunkRecord> all() {
        maybeReload();
        return chunks.values();
    }

    private ChunkRecord find(String chunkId) {
        maybeReload();
        if (chunkId == null) {
            return null;
        }
        return chunks.get(chunkId);
    }

    private void maybeReload() {
        if (Instant.now().toEpochMilli() - lastLoadedAt < properties.getRefreshMs()) {
            return;
        }
        reload();
    }

    private synchronized void reload() {
        long now = Instant.now().toEpochMilli();
        if (now - lastLoadedAt < properties.getRefreshMs()) {
            return;
        }
        Path path = resolvePath(properties.getPath());
        if (!Files.exists(path)) {
            chunks = Collections.emptyMap();
            lastLoadedAt = now;
            return;
        }
        try {
            long modified = Files.getLastModifiedTime(path).toMillis();
            if (modified == lastModified && !chunks.isEmpty()) {
                lastLoadedAt = now;
                return;
            }
            byte[] content = Files.readAllBytes(path);
            Map<String, Map<String, Object>> data = objectMapper.readValue(
                content,
                new TypeReference<>() {}
            );
            chunks = data == null ? Collections.emptyMap() : toRecords(data);
            lastModified = modified;
            lastLoadedAt = now;
            log.info("chunk store loaded path={} chunks={}", path, chunks.size());
        } catch (IOException ex) {
            log.warn("chunk store load failed", ex);
            chunks = Collections.emptyMap();
            lastLoadedAt = now;
        }
    }

    private Map<String, ChunkRecord> toRecords(Map<String, Map<String, Object>> data) {
        Map<String, ChunkRecord> records = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : data.entrySet()) {
            Map<String, Object> raw = entry.getValue();
            if (entry.getKey() == null || raw == null) {
                continue;
            }
            records.put(
                entry.getKey(),
                new ChunkRecord(
                    entry.getKey(),
                    raw.get("content") == null ? null : raw.get("content").toString(),
                    toDimensionScores(raw.get("dimension_scores")),
                    clamp01(toDouble(raw.get("recency_score"))),
                    clamp01(toDouble(raw.get("confidence_score"))),
                    toVector(raw.get("embedding"))
                )
            );
        }
        return Collections.unmodifiableMap(records);
    }

    private Map<String, DimensionScore> toDimensionScores(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, DimensionScore> scores = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String dimension = entry.getKey() == null ? null : entry.getKey().toString();
            if (dimension == null) {
                continue;
            }
            if (entry.getValue() instanceof Map<?, ?> detail) {
                Double value = toDouble(detail.get("value"));
                if (value != null) {
                    Double confidence = toDouble(detail.get("confidence"));
                    scores.put(dimension, new DimensionScore(value, confidence == null ? null : clamp01(confidence)));
                }
            } else {
                Double value = toDouble(entry.getValue());
                if (value != null) {
                    scores.put(dimension, DimensionScore.of(value));
                }
            }
        }
        return scores;
    }

    private List<Double> toVector(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<Double> vector = new ArrayList<>(list.size());
        for (Object item : list) {
            Double value = toDouble(item);
            vector.add(value == null ? 0.0 : value);
        }
        return vector;
    }

    private Path resolvePath(String path) {
        Path direct = Path.of(path);
        if (Files.exists(direct) || direct.isAbsolute()) {
            return direct;
        }
        Path candidate = direct;
        for (int i = 0; i < 4; i++) {
            if (Files.exists(candidate)) {
                return candidate;
            }
            candidate = Path.of("..").resolve(candidate).normalize();
        }
        return direct;
    }

    private double clamp01(Double value) {
        if (value == null || value.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private Double toDouble(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
