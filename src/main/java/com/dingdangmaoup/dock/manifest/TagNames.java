package com.dingdangmaoup.dock.manifest;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Cached form of a repository's sorted tag names.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagNames {
    private List<String> tags;
}
