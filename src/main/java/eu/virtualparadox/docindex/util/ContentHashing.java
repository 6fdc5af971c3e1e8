package eu.virtualparadox.docindex.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Content identity of documents: lowercase hex SHA-256 of the raw bytes.
 */
public final class ContentHashing {

    private static final Pattern HASH_PATTERN = Pattern.compile("[0-9a-f]{64}");

    private ContentHashing() {
        // prevent instantiation
    }

    public static String sha256(final Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return DigestUtils.sha256Hex(in);
        }
    }

    public static String sha256(final byte[] bytes) {
        return DigestUtils.sha256Hex(bytes);
    }

    public static boolean looksLikeHash(final String value) {
        return value != null && HASH_PATTERN.matcher(value).matches();
    }

    /**
     * First eight characters, for log lines.
     */
    public static String abbreviate(final String fileHash) {
        if (fileHash == null) {
            return "null";
        }
        return fileHash.length() <= 8 ? fileHash : fileHash.substring(0, 8) + "...";
    }
}
