package com.di.healthnova.model;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Raw export file handed to a provider adapter. Content is held in memory; exports are batch files
 * of bounded size.
 */
public final class RawFile {

    private final String reference;
    private final String fileName;
    private final byte[] content;
    private volatile String sha256;

    public RawFile(String reference, String fileName, byte[] content) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    public static RawFile of(String fileName, String text) {
        return new RawFile(fileName, fileName, text.getBytes(StandardCharsets.UTF_8));
    }

    public String getReference() {
        return reference;
    }

    public String getFileName() {
        return fileName;
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(content);
    }

    public int size() {
        return content.length;
    }

    /** Hex SHA-256 of the content; stamped on every canonical record as its source file hash. */
    public String sha256() {
        String hash = sha256;
        if (hash == null) {
            try {
                MessageDigest digest = MessageDigest.getInstance("SHA-256");
                hash = HexFormat.of().formatHex(digest.digest(content));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 not available", e);
            }
            sha256 = hash;
        }
        return hash;
    }

    @Override
    public String toString() {
        return "RawFile[" + reference + ", " + content.length + " bytes]";
    }
}
