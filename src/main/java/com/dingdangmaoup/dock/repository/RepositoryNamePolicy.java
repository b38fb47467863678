package com.dingdangmaoup.dock.repository;

import com.dingdangmaoup.dock.config.properties.RegistryProperties;
import com.dingdangmaoup.dock.exception.RepositoryInvalidException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Repository and tag naming rules, taken from {@code dock.registry.naming}.
 */
@Component
public class RepositoryNamePolicy {

    private final Pattern repositoryPattern;
    private final int repositoryMaxLength;
    private final Pattern tagPattern;
    private final int tagMaxLength;

    public RepositoryNamePolicy(RegistryProperties registryProperties) {
        RegistryProperties.Naming naming = registryProperties.getNaming();
        this.repositoryPattern = Pattern.compile(naming.getRepositoryPattern());
        this.repositoryMaxLength = naming.getRepositoryMaxLength();
        this.tagPattern = Pattern.compile(naming.getTagPattern());
        this.tagMaxLength = naming.getTagMaxLength();
    }

    public void validateRepository(String repository) {
        if (repository == null || repository.isEmpty()) {
            throw RepositoryInvalidException.name(repository, "empty name");
        }
        if (repository.length() > repositoryMaxLength) {
            throw RepositoryInvalidException.name(repository, "longer than " + repositoryMaxLength + " characters");
        }
        if (!repositoryPattern.matcher(repository).matches()) {
            throw RepositoryInvalidException.name(repository, "does not match " + repositoryPattern.pattern());
        }
    }

    public void validateTag(String tag) {
        if (tag == null || tag.isEmpty()) {
            throw RepositoryInvalidException.tag(tag, "empty tag");
        }
        if (tag.length() > tagMaxLength) {
            throw RepositoryInvalidException.tag(tag, "longer than " + tagMaxLength + " characters");
        }
        if (!tagPattern.matcher(tag).matches()) {
            throw RepositoryInvalidException.tag(tag, "does not match " + tagPattern.pattern());
        }
    }
}
