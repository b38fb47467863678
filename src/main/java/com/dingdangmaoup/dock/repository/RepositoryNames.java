package com.dingdangmaoup.dock.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Cached form of the full, sorted repository listing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RepositoryNames {
    private List<String> names;
}
