package com.pipewright.core.state;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Current on-disk state of an output file: missing, unreadable, or present with a hash.
 */
public record OutputFingerprint(boolean exists, String hash, String error) {

    public static OutputFingerprint missing() {
        return new OutputFingerprint(false, null, null);
    }

    public static OutputFingerprint of(String hash) {
        return new OutputFingerprint(true, hash, null);
    }

    public static OutputFingerprint unreadable(String error) {
        return new OutputFingerprint(true, null, error);
    }

    public static OutputFingerprint probe(Path path) {
        if (!Files.exists(path)) {
            return missing();
        }
        try {
            return of(ContentHasher.hashFile(path));
        } catch (IOException e) {
            return unreadable(e.getMessage());
        }
    }
}
