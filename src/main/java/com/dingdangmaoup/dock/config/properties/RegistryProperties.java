package com.dingdangmaoup.dock.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Registry behaviour switches
 */
@Data
@Component
@ConfigurationProperties(prefix = "dock.registry")
public class RegistryProperties {

    /**
     * Create a repository on its first push instead of answering NAME_UNKNOWN
     */
    private boolean autoCreateRepositories = true;

    /**
     * Reject manifests whose config, layers or child manifests are not stored yet
     */
    private boolean strictManifestReferences = false;

    private Naming naming = new Naming();

    @Data
    public static class Naming {
        private String repositoryPattern =
                "[a-z0-9]+(?:(?:[._]|__|-+)[a-z0-9]+)*(?:/[a-z0-9]+(?:(?:[._]|__|-+)[a-z0-9]+)*)*";
        private int repositoryMaxLength = 255;
        private String tagPattern = "[A-Za-z0-9_][A-Za-z0-9._-]*";
        private int tagMaxLength = 128;
    }
}
