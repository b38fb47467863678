package com.dingdangmaoup.dock.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Connection settings of the shared cache tier
 */
@Data
@Component
@ConfigurationProperties(prefix = "dock.redis")
public class RedisProperties {

    private Mode mode = Mode.STANDALONE;
    private String host = "localhost";
    private int port = 6379;
    private String password;
    private int database = 0;

    /**
     * Command timeout; keep it short, a slow shared cache is treated as a miss
     */
    private Duration timeout = Duration.ofMillis(500);

    private ClusterConfig cluster = new ClusterConfig();

    private SentinelConfig sentinel = new SentinelConfig();

    public enum Mode {
        STANDALONE,
        CLUSTER,
        SENTINEL
    }

    public boolean hasPassword() {
        return password != null && !password.isBlank();
    }

    @Data
    public static class ClusterConfig {
        private String nodes;
        private int maxRedirects = 3;

        public List<String> getNodesList() {
            return splitNodes(nodes);
        }
    }

    @Data
    public static class SentinelConfig {
        private String master = "mymaster";
        private String nodes;

        public List<String> getNodesList() {
            return splitNodes(nodes);
        }
    }

    static List<String> splitNodes(String nodes) {
        if (nodes == null || nodes.isBlank()) {
            return List.of();
        }
        return Arrays.stream(nodes.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
