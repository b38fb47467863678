package com.dingdangmaoup.dock.registry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the 202 answers during an upload; clients rely on the headers, which carry the same values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {
    private String uuid;
    private String location;
    private long offset;
}
