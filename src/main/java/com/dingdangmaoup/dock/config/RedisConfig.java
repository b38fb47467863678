package com.dingdangmaoup.dock.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConfiguration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisSentinelConfiguration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;

import java.time.Duration;
import java.util.List;

/**
 * Shared cache tier connection. Connections are opened lazily, so the
 * registry starts and serves from the local tier when Redis is down.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class RedisConfig {

  private final RedisProperties redisProperties;

  @Bean
  public LettuceConnectionFactory lettuceConnectionFactory() {
    ClientOptions clientOptions = redisProperties.getMode() == RedisProperties.Mode.CLUSTER
        ? ClusterClientOptions.builder()
            .topologyRefreshOptions(ClusterTopologyRefreshOptions.builder()
                .enablePeriodicRefresh(Duration.ofMinutes(10))
                .enableAllAdaptiveRefreshTriggers()
                .build())
            .autoReconnect(true)
            .build()
        : ClientOptions.builder()
            .autoReconnect(true)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .build();

    LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
        .commandTimeout(redisProperties.getTimeout())
        .clientOptions(clientOptions)
        .build();

    RedisConfiguration redisConfiguration = switch (redisProperties.getMode()) {
      case STANDALONE -> standaloneConfiguration();
      case CLUSTER -> clusterConfiguration();
      case SENTINEL -> sentinelConfiguration();
    };

    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfiguration, clientConfig);

    log.info("Initializing shared cache connection factory with mode: {}", redisProperties.getMode());
    return factory;
  }

  @Bean
  public ReactiveRedisTemplate<String, String> reactiveRedisTemplate(
      LettuceConnectionFactory connectionFactory) {
    return new ReactiveRedisTemplate<>(connectionFactory, RedisSerializationContext.string());
  }

  private RedisStandaloneConfiguration standaloneConfiguration() {
    RedisStandaloneConfiguration config = new RedisStandaloneConfiguration(
        redisProperties.getHost(), redisProperties.getPort());
    config.setDatabase(redisProperties.getDatabase());
    if (redisProperties.hasPassword()) {
      config.setPassword(RedisPassword.of(redisProperties.getPassword()));
    }
    return config;
  }

  private RedisClusterConfiguration clusterConfiguration() {
    List<String> nodes = redisProperties.getCluster().getNodesList();
    if (nodes.isEmpty()) {
      throw new IllegalStateException("dock.redis.cluster.nodes is not configured");
    }

    RedisClusterConfiguration config = new RedisClusterConfiguration(nodes);
    config.setMaxRedirects(redisProperties.getCluster().getMaxRedirects());
    if (redisProperties.hasPassword()) {
      config.setPassword(RedisPassword.of(redisProperties.getPassword()));
    }
    return config;
  }

  private RedisSentinelConfiguration sentinelConfiguration() {
    List<String> sentinelNodes = redisProperties.getSentinel().getNodesList();
    if (sentinelNodes.isEmpty()) {
      throw new IllegalStateException("dock.redis.sentinel.nodes is not configured");
    }

    RedisSentinelConfiguration config = new RedisSentinelConfiguration()
        .master(redisProperties.getSentinel().getMaster());
    sentinelNodes.forEach(node -> {
      String[] parts = node.split(":");
      config.sentinel(parts[0], Integer.parseInt(parts[1]));
    });
    config.setDatabase(redisProperties.getDatabase());
    if (redisProperties.hasPassword()) {
      config.setPassword(RedisPassword.of(redisProperties.getPassword()));
    }
    return config;
  }
}
