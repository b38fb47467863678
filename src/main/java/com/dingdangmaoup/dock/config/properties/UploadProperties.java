package com.dingdangmaoup.dock.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Blob upload session configuration
 */
@Data
@Component
@ConfigurationProperties(prefix = "dock.upload")
public class UploadProperties {

    /**
     * Idle time after which a session is expired
     */
    private Duration sessionTtl = Duration.ofHours(1);

    /**
     * Largest request body accepted for one PATCH, PUT or monolithic POST
     */
    private DataSize maxChunkSize = DataSize.ofMegabytes(64);
}
