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
public class TagRecord {
    private String name;
    private String digest;
    private Instant updatedAt;
}
