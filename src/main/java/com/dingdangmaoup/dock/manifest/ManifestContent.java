package com.dingdangmaoup.dock.manifest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A manifest as served to clients: the exact pushed bytes with their digest and media type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManifestContent {
    private String digest;
    private String mediaType;
    private byte[] content;
}
