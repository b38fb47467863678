package com.dingdangmaoup.dock.digest;

import com.dingdangmaoup.dock.exception.DigestMismatchException;
import com.dingdangmaoup.dock.exception.StoreUnavailableException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes and verifies content digests. Stateless; every write path goes
 * through {@link #verify(byte[], Digest)} or {@link #compute(Path, DigestAlgorithm)}.
 */
@Component
public class DigestEngine {

    private static final int BUFFER_SIZE = 64 * 1024;

    public Digest compute(byte[] content) {
        return compute(content, DigestAlgorithm.SHA256);
    }

    public Digest compute(byte[] content, DigestAlgorithm algorithm) {
        MessageDigest messageDigest = newMessageDigest(algorithm);
        return Digest.of(algorithm, HexFormat.of().formatHex(messageDigest.digest(content)));
    }

    /**
     * Digest of a file, read in fixed-size blocks.
     */
    public Digest compute(Path file, DigestAlgorithm algorithm) {
        MessageDigest messageDigest = newMessageDigest(algorithm);
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                messageDigest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read " + file + " for digest", e);
        }
        return Digest.of(algorithm, HexFormat.of().formatHex(messageDigest.digest()));
    }

    public boolean matches(byte[] content, Digest expected) {
        return compute(content, expected.getAlgorithm()).equals(expected);
    }

    /**
     * @throws DigestMismatchException when the content hashes to something else
     */
    public Digest verify(byte[] content, Digest expected) {
        Digest actual = compute(content, expected.getAlgorithm());
        if (!actual.equals(expected)) {
            throw new DigestMismatchException(expected.toString(), actual.toString());
        }
        return actual;
    }

    private MessageDigest newMessageDigest(DigestAlgorithm algorithm) {
        try {
            return MessageDigest.getInstance(algorithm.getJcaName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JDK is missing " + algorithm.getJcaName(), e);
        }
    }
}
