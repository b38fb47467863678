package com.dingdangmaoup.dock.storage;

import com.dingdangmaoup.dock.digest.Digest;

import java.util.List;
import java.util.Optional;

/**
 * Per-repository index: which repositories exist, which tags point where,
 * which manifests and blobs a repository references.
 * <p>
 * Calls block. Callers run them on a bounded elastic scheduler and hold the
 * repository lock around multi-step updates. I/O failures are reported as
 * {@link com.dingdangmaoup.dock.exception.StoreUnavailableException}.
 */
public interface MetadataStore {

    boolean repositoryExists(String repository);

    /**
     * @return true if the repository was created by this call
     */
    boolean createRepository(String repository);

    /**
     * Remove the repository with all of its tags, revisions and blob links.
     *
     * @return true if the repository existed
     */
    boolean deleteRepository(String repository);

    /**
     * @return every repository name, sorted
     */
    List<String> listRepositories();

    Optional<TagRecord> getTag(String repository, String tag);

    void putTag(String repository, TagRecord tag);

    boolean deleteTag(String repository, String tag);

    /**
     * @return tags of the repository sorted by name
     */
    List<TagRecord> listTags(String repository);

    Optional<ManifestRevision> getRevision(String repository, Digest digest);

    void putRevision(String repository, ManifestRevision revision);

    boolean deleteRevision(String repository, Digest digest);

    List<ManifestRevision> listRevisions(String repository);

    void linkBlob(String repository, BlobLink link);

    Optional<BlobLink> getBlobLink(String repository, Digest digest);

    boolean unlinkBlob(String repository, Digest digest);
}
