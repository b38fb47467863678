package com.dingdangmaoup.dock.registry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlobResponse {
    private String digest;
    private long size;
    private String location;
}
