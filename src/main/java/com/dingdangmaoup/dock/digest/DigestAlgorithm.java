package com.dingdangmaoup.dock.digest;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum DigestAlgorithm {

    SHA256("sha256", "SHA-256", 64),
    SHA512("sha512", "SHA-512", 128);

    private final String prefix;
    private final String jcaName;
    private final int hexLength;

    public static Optional<DigestAlgorithm> fromPrefix(String prefix) {
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.prefix.equals(prefix))
                .findFirst();
    }
}
