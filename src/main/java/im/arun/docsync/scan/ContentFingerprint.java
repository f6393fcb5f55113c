package im.arun.docsync.scan;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable hash of document content.
 * <p>
 * Whitespace runs are collapsed to one space and the ends are trimmed before hashing,
 * so re-indenting or re-wrapping a document does not count as a change. Everything
 * else is compared exactly.
 */
public final class ContentFingerprint {

    private ContentFingerprint() {}

    public static String of(String content) {
        if (content == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalize(content).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    static String normalize(String content) {
        return content.replaceAll("\\s+", " ").strip();
    }
}
