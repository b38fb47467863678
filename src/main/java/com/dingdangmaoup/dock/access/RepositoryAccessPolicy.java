package com.dingdangmaoup.dock.access;

import reactor.core.publisher.Mono;

/**
 * Capability check consumed by the registry core. Identity and permissions
 * live outside the registry; this is the only question it asks them.
 */
public interface RepositoryAccessPolicy {

    /**
     * @return an empty Mono when allowed, or an AccessDeniedException
     */
    Mono<Void> check(String repository, Capability capability);
}
