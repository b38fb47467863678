package com.dingdangmaoup.dock.registry.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManifestPutResponse {
    private String digest;
    private String location;
}
