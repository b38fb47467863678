package com.dingdangmaoup.dock.storage;

import com.dingdangmaoup.dock.digest.Digest;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable byte store addressed by digest. It does not hash what it is given:
 * callers verify content before handing it over.
 */
public interface ContentStore {

    /**
     * Store content under a digest. Storing a digest that is already present
     * is a no-op and does not consume {@code data}.
     *
     * @param digest the verified digest of the content
     * @param data   the content stream
     * @return Mono emitting the stored blob metadata
     */
    Mono<BlobMetadata> put(Digest digest, Flux<DataBuffer> data);

    default Mono<BlobMetadata> put(Digest digest, byte[] content) {
        return put(digest, Flux.defer(() -> Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(content))));
    }

    /**
     * Stream stored content
     *
     * @param digest the blob digest
     * @return Flux emitting the content, or a NotFoundException
     */
    Flux<DataBuffer> get(Digest digest);

    default Mono<byte[]> readAll(Digest digest) {
        return DataBufferUtils.join(get(digest))
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                });
    }

    Mono<Boolean> exists(Digest digest);

    /**
     * @return Mono emitting metadata, or a NotFoundException
     */
    Mono<BlobMetadata> stat(Digest digest);

    /**
     * @return Mono emitting true if something was deleted
     */
    Mono<Boolean> delete(Digest digest);

    Mono<Long> totalSize();

    Mono<Long> availableSpace();
}
