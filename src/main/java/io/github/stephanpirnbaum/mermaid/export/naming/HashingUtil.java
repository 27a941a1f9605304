package io.github.stephanpirnbaum.mermaid.export.naming;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content identity of diagram text.
 *
 * @author Stephan Pirnbaum
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class HashingUtil {

    public static final int SHORT_HASH_LENGTH = 8;

    /**
     * Hash of the trimmed content, shortened to {@value #SHORT_HASH_LENGTH} lowercase hex characters.
     * Empty content is hashed like any other content.
     */
    public static String shortHash(String content) {
        return sha256Hex(trim(content).getBytes(StandardCharsets.UTF_8)).substring(0, SHORT_HASH_LENGTH);
    }

    /**
     * Removes leading and trailing whitespace including Unicode space separators, line separators and the byte order
     * mark, which {@link String#trim()} and {@link String#strip()} keep.
     */
    public static String trim(String content) {
        if (content == null) {
            return "";
        }
        int start = 0;
        int end = content.length();
        while (start < end && isTrimmable(content.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(start, end);
    }

    private static boolean isTrimmable(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >>> 4) & 0xF, 16))
                    .append(Character.forDigit((b & 0xF), 16));
        }
        return sb.toString();
    }
}
