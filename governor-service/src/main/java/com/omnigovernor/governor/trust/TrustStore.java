package com.omnigovernor.governor.trust;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omnigovernor.governor.config.GovernorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;

/**
 * Durable copy of the trust score map: one JSON object {@code source → score}.
 */
@Component
public class TrustStore {

    private static final Logger log = LoggerFactory.getLogger(TrustStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public TrustStore(GovernorProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.trust().file()), objectMapper);
    }

    TrustStore(Path file, ObjectMapper objectMapper) {
        this.file         = file;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the stored map, or empty when the file is absent or unreadable
     */
    public Optional<Map<String, Double>> read() {
        if (!Files.exists(file)) {
            log.info("No trust document at {}; using seed scores", file.toAbsolutePath());
            return Optional.empty();
        }
        try {
            Map<String, Double> scores = objectMapper.readValue(file.toFile(), new TypeReference<Map<String, Double>>() {});
            return Optional.ofNullable(scores);
        } catch (IOException e) {
            log.warn("Trust document {} is unreadable; using seed scores. reason={}",
                     file.toAbsolutePath(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Rewrites the whole document. Writes a sibling temp file first and moves it into place,
     * so readers never observe a half-written document.
     */
    public void write(Map<String, Double> scores) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), scores);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist trust scores to " + file, e);
        }
    }
}
