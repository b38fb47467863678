package com.dingdangmaoup.dock.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlobMetadata {
    private String digest;
    private long size;
    private String mediaType;
    private Instant createdAt;
}
