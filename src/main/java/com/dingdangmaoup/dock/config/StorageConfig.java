package com.dingdangmaoup.dock.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Slf4j
@Configuration
public class StorageConfig {

    @Value("${dock.storage.base-path:/data/dock}")
    private String basePath;

    @Value("${dock.storage.temp-dir:${dock.storage.base-path:/data/dock}/temp}")
    private String tempDir;

    @PostConstruct
    public void initializeStorage() {
        try {
            Path base = Paths.get(basePath);
            Path blobs = base.resolve("blobs");
            Path repositories = base.resolve("repositories");
            Path temp = Paths.get(tempDir);

            Files.createDirectories(blobs);
            Files.createDirectories(repositories);
            Files.createDirectories(temp.resolve("uploads"));
            Files.createDirectories(temp.resolve("blobs"));

            log.info("Initialized storage directories:");
            log.info("  Base path: {}", base.toAbsolutePath());
            log.info("  Blobs: {}", blobs.toAbsolutePath());
            log.info("  Repositories: {}", repositories.toAbsolutePath());
            log.info("  Temp: {}", temp.toAbsolutePath());

            if (!Files.isWritable(base)) {
                throw new IllegalStateException("Base storage path is not writable: " + base);
            }
        } catch (IOException e) {
            log.error("Failed to initialize storage directories", e);
            throw new IllegalStateException("Failed to initialize storage", e);
        }
    }
}
