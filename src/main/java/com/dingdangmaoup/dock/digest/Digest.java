package com.dingdangmaoup.dock.digest;

import com.dingdangmaoup.dock.exception.DigestInvalidException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Algorithm-tagged content hash, e.g. {@code sha256:9f86d0...}.
 */
@Getter
@EqualsAndHashCode
public final class Digest {

    private static final Pattern HEX = Pattern.compile("[a-f0-9]+");

    private final DigestAlgorithm algorithm;
    private final String hex;

    private Digest(DigestAlgorithm algorithm, String hex) {
        this.algorithm = algorithm;
        this.hex = hex;
    }

    public static Digest of(DigestAlgorithm algorithm, String hex) {
        if (hex == null || hex.length() != algorithm.getHexLength() || !HEX.matcher(hex).matches()) {
            throw new DigestInvalidException(algorithm.getPrefix() + ":" + hex);
        }
        return new Digest(algorithm, hex);
    }

    public static Digest parse(String value) {
        if (value == null) {
            throw new DigestInvalidException(null);
        }
        int colon = value.indexOf(':');
        if (colon <= 0) {
            throw new DigestInvalidException(value);
        }
        DigestAlgorithm algorithm = DigestAlgorithm.fromPrefix(value.substring(0, colon))
                .orElseThrow(() -> new DigestInvalidException(value));
        return of(algorithm, value.substring(colon + 1));
    }

    /**
     * True for anything shaped like {@code alg:hex}; used to tell digests from tags.
     */
    public static boolean looksLikeDigest(String reference) {
        return reference != null && reference.indexOf(':') > 0;
    }

    @Override
    public String toString() {
        return algorithm.getPrefix() + ":" + hex;
    }
}
