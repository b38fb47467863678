package com.dingdangmaoup.dock.access;

import com.dingdangmaoup.dock.config.properties.AccessProperties;
import com.dingdangmaoup.dock.exception.AccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Pulls are always allowed; pushes and deletes are refused for a read-only
 * registry or for repositories under a read-only prefix.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfiguredRepositoryAccessPolicy implements RepositoryAccessPolicy {

    private final AccessProperties accessProperties;

    @Override
    public Mono<Void> check(String repository, Capability capability) {
        return Mono.defer(() -> {
            if (capability.isMutating() && isReadOnly(repository)) {
                log.info("Denied {} on repository {}", capability, repository);
                return Mono.error(new AccessDeniedException(repository, capability.name().toLowerCase()));
            }
            return Mono.empty();
        });
    }

    private boolean isReadOnly(String repository) {
        return accessProperties.isReadOnly()
                || accessProperties.getReadOnlyRepositories().stream().anyMatch(repository::startsWith);
    }
}
