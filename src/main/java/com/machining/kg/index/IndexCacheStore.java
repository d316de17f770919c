package com.machining.kg.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.machining.kg.config.IndexProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON file cache of the last built index under {@code machining.index.cache-dir}.
 * The graph stays the source of truth: a missing or unreadable cache only means a rebuild.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexCacheStore {

    static final String CACHE_FILE = "knowledge-index.json";

    private final IndexProperties indexProperties;
    private final ObjectMapper objectMapper;

    public void save(KnowledgeIndex index) throws IOException {
        if (!indexProperties.isPersist()) {
            return;
        }
        Path target = cacheFile();
        Files.createDirectories(target.getParent());
        Path temp = target.resolveSibling(CACHE_FILE + ".tmp");
        objectMapper.writeValue(temp.toFile(), index);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("Saved knowledge index ({} units) to {}", index.size(), target);
    }

    public Optional<KnowledgeIndex> load() {
        Path file = cacheFile();
        if (!indexProperties.isPersist() || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            KnowledgeIndex index = objectMapper.readValue(file.toFile(), KnowledgeIndex.class);
            log.info("Loaded cached knowledge index ({} units, built {}) from {}", index.size(), index.getBuiltAt(), file);
            return Optional.of(index);
        } catch (IOException e) {
            log.warn("Ignoring unreadable index cache {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Path cacheFile() {
        return Path.of(indexProperties.getCacheDir()).toAbsolutePath().resolve(CACHE_FILE);
    }
}
