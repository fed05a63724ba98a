package fr.lapetina.ocr.pipeline.infrastructure.storage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Blob read from an {@link ObjectStore} together with its version tag.
 * The version is a content digest, comparable to an S3 ETag.
 */
public record StoredObject(String key, byte[] data, String version) {

    public StoredObject {
        Objects.requireNonNull(key, "Key is required");
        Objects.requireNonNull(data, "Data is required");
        Objects.requireNonNull(version, "Version is required");
    }

    public static StoredObject of(String key, byte[] data) {
        return new StoredObject(key, data, versionOf(data));
    }

    public String asString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    public static String versionOf(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
