package com.dingdangmaoup.dock.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A manifest known to one repository. The bytes live in the content store under {@link #digest}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ManifestRevision {
    private String digest;
    private String mediaType;
    private long size;
    /**
     * Pushed by digest; kept even when no tag points at it.
     */
    private boolean pinned;
    private Instant createdAt;
}
