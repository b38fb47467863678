package com.dingdangmaoup.dock.access;

import com.dingdangmaoup.dock.config.properties.AccessProperties;
import com.dingdangmaoup.dock.exception.AccessDeniedException;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

class ConfiguredRepositoryAccessPolicyTest {

    @Test
    void everythingAllowedByDefault() {
        RepositoryAccessPolicy policy = new ConfiguredRepositoryAccessPolicy(new AccessProperties());

        for (Capability capability : Capability.values()) {
            StepVerifier.create(policy.check("app", capability)).verifyComplete();
        }
    }

    @Test
    void readOnlyRegistryStillServesPulls() {
        AccessProperties properties = new AccessProperties();
        properties.setReadOnly(true);
        RepositoryAccessPolicy policy = new ConfiguredRepositoryAccessPolicy(properties);

        StepVerifier.create(policy.check("app", Capability.PULL)).verifyComplete();
        StepVerifier.create(policy.check("app", Capability.PUSH)).expectError(AccessDeniedException.class).verify();
        StepVerifier.create(policy.check("app", Capability.DELETE)).expectError(AccessDeniedException.class).verify();
    }

    @Test
    void readOnlyPrefixesOnlyAffectMatchingRepositories() {
        AccessProperties properties = new AccessProperties();
        properties.setReadOnlyRepositories(List.of("library/"));
        RepositoryAccessPolicy policy = new ConfiguredRepositoryAccessPolicy(properties);

        StepVerifier.create(policy.check("library/alpine", Capability.PUSH)).expectError(AccessDeniedException.class).verify();
        StepVerifier.create(policy.check("myteam/alpine", Capability.PUSH)).verifyComplete();
    }
}
