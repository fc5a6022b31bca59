package com.titiplex.engagement.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Réglages locaux persistés dans {@code config.json}, à côté de la base.
 */
@Service
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Path cfgPath;

    public ConfigService(@Value("${app.data.dir}") String dataDir) {
        this.cfgPath = Paths.get(dataDir).resolve("config.json");
    }

    public void saveLastSweep(SweepState state) {
        try {
            Map<String, Object> root = new LinkedHashMap<>();
            root.put("lastSweep", state);
            Files.createDirectories(cfgPath.getParent());
            Files.writeString(cfgPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture de " + cfgPath + " impossible", e);
        }
    }

    /**
     * Relit le dernier balayage ; {@code null} si le fichier est absent ou illisible.
     */
    public SweepState lastSweep() {
        if (!Files.exists(cfgPath)) return null;
        try {
            var root = mapper.readTree(Files.readAllBytes(cfgPath));
            var node = root.get("lastSweep");
            if (node == null || node.isNull()) return null;
            return mapper.treeToValue(node, SweepState.class);
        } catch (IOException e) {
            log.warn("config.json illisible, ignoré: {}", e.getMessage());
            return null;
        }
    }

    public void clear() throws IOException {
        Files.deleteIfExists(cfgPath);
    }
}
