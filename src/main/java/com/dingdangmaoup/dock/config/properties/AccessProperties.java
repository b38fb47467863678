package com.dingdangmaoup.dock.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "dock.access")
public class AccessProperties {

    /**
     * Refuse every push and delete
     */
    private boolean readOnly = false;

    /**
     * Repository name prefixes that only allow pulls, e.g. {@code library/}
     */
    private List<String> readOnlyRepositories = new ArrayList<>();
}
