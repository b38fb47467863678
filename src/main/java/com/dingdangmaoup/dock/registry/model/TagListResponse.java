package com.dingdangmaoup.dock.registry.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagListResponse {
    private String name;
    private List<String> tags;
}
