package com.dingdangmaoup.dock.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class StorageConfigTest {

    @TempDir
    Path base;

    @Test
    void createsStorageLayout() {
        StorageConfig config = new StorageConfig();
        ReflectionTestUtils.setField(config, "basePath", base.toString());
        ReflectionTestUtils.setField(config, "tempDir", base.resolve("temp").toString());

        config.initializeStorage();

        assertThat(base.resolve("blobs")).isDirectory();
        assertThat(base.resolve("repositories")).isDirectory();
        assertThat(base.resolve("temp/uploads")).isDirectory();
        assertThat(base.resolve("temp/blobs")).isDirectory();
    }
}
