package com.example.jestadapter.service;

import com.example.jestadapter.config.AdapterProperties;
import com.example.jestadapter.model.CoverageDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * Moves the coverage artifact of a run into the report area and writes a descriptor for it.
 * Failures are logged and never propagated.
 */
@Service
public class CoverageRelocator {

    private static final Logger log = LoggerFactory.getLogger(CoverageRelocator.class);

    private final ObjectMapper objectMapper;
    private final AdapterProperties properties;

    public CoverageRelocator(ObjectMapper objectMapper, AdapterProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Copies the artifact to {@code <reportPath>/<uuid>_<artifact name>}, deletes the source, and
     * writes {@code <projectPath>/<index dir>/<uuid>.json}. The source is only deleted after a
     * successful copy.
     *
     * @return the descriptor file, empty if there was nothing to relocate or relocation failed
     */
    public Optional<Path> relocate(Path projectPath, Path reportPath) {
        AdapterProperties.Coverage coverage = properties.coverage();
        Path source = projectPath.resolve(coverage.artifact());
        if (!Files.isRegularFile(source)) {
            log.error("Coverage file not found at {}", source);
            return Optional.empty();
        }

        String id = UUID.randomUUID().toString();
        Path target = reportPath.resolve(id + "_" + source.getFileName());
        try {
            Files.createDirectories(reportPath);
            Files.copy(source, target);
        } catch (IOException e) {
            log.error("Unable to copy coverage file {} to {}: {}", source, target, e.getMessage());
            return Optional.empty();
        }

        try {
            Files.delete(source);
        } catch (IOException e) {
            log.warn("Coverage file copied but the source {} could not be deleted: {}", source, e.getMessage());
        }

        CoverageDescriptor descriptor = new CoverageDescriptor(
                target.toAbsolutePath().toString(),
                coverage.format(),
                projectPath.toAbsolutePath().toString());
        Path indexDir = projectPath.resolve(coverage.indexDir());
        Path descriptorFile = indexDir.resolve(id + ".json");
        try {
            Files.createDirectories(indexDir);
            objectMapper.writeValue(descriptorFile.toFile(), descriptor);
        } catch (IOException e) {
            log.error("Unable to write coverage descriptor {}: {}", descriptorFile, e.getMessage());
            return Optional.empty();
        }

        log.info("Coverage file relocated to {}, descriptor written to {}", target, descriptorFile);
        return Optional.of(descriptorFile);
    }
}
