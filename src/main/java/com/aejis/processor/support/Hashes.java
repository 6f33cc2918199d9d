package com.aejis.processor.support;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Hashes {

    private Hashes() {}

    public static String sha256(byte[] data) {
        return digest("SHA-256", data);
    }

    /** md5, sha1 and sha256, in that order. */
    public static Map<String, String> all(byte[] data) {
        var hashes = new LinkedHashMap<String, String>();
        hashes.put("md5", digest("MD5", data));
        hashes.put("sha1", digest("SHA-1", data));
        hashes.put("sha256", digest("SHA-256", data));
        return hashes;
    }

    private static String digest(String algorithm, byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance(algorithm).digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available in this JVM", e);
        }
    }
}
