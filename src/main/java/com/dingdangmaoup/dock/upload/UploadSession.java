package com.dingdangmaoup.dock.upload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One resumable blob upload. {@link #offset} is the number of bytes accepted
 * so far, which is also the size of the spool file. Mutated only under the
 * session lock.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UploadSession {
    private String id;
    private String repository;
    private long offset;
    private Path spoolFile;
    private Instant createdAt;
    private Instant lastActivity;
    private UploadState state;

    /**
     * Copy handed out to callers, so they never see later mutations
     */
    public UploadSession snapshot() {
        return toBuilder().build();
    }
}
