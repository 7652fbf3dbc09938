package com.pipewright.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 content hashing for the resume state.
 */
public final class ContentHasher {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private ContentHasher() {}

    /**
     * Hashes a set of files into one digest. Each file contributes its path relative to
     * {@code baseDir} followed by its content, so a rename changes the digest even when the
     * content does not. Paths are sorted first; input order never matters.
     *
     * @param baseDir directory the recorded paths are relative to; {@code null} to use paths as given
     * @param files   files to hash
     */
    public static String hashFiles(Path baseDir, Collection<Path> files) throws IOException {
        var byRelativePath = new TreeMap<String, Path>();
        for (Path file : files) {
            byRelativePath.put(relativeName(baseDir, file), file);
        }

        MessageDigest digest = sha256();
        for (var entry : byRelativePath.entrySet()) {
            digest.update(entry.getKey().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(Files.readAllBytes(entry.getValue()));
            digest.update((byte) 0);
        }
        return toHex(digest.digest());
    }

    public static String hashFile(Path file) throws IOException {
        MessageDigest digest = sha256();
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return toHex(digest.digest());
    }

    public static String hashBytes(byte[] data) {
        return toHex(sha256().digest(data));
    }

    /**
     * Hashes the configuration that shapes every task's output. Map keys are sorted, so
     * two equal configurations always hash the same regardless of insertion order.
     */
    public static String hashConfig(String persona, Map<String, String> stack, Map<String, String> preferences) {
        var config = new LinkedHashMap<String, Object>();
        config.put("persona", persona);
        config.put("stack", stack != null ? stack : Map.of());
        config.put("preferences", preferences != null ? preferences : Map.of());
        try {
            return hashBytes(CANONICAL.writeValueAsBytes(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Configuration is not serialisable", e);
        }
    }

    private static String relativeName(Path baseDir, Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (baseDir != null) {
            Path base = baseDir.toAbsolutePath().normalize();
            if (normalized.startsWith(base)) {
                normalized = base.relativize(normalized);
            }
        }
        return normalized.toString().replace('\\', '/');
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        var sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
