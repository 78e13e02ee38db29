package eu.okaeri.cellstore.index;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * Derives index column names from document paths: every run of characters outside
 * {@code [a-zA-Z0-9]} becomes a single {@code _}, the result is capped at
 * {@value #MAX_BODY_LENGTH} characters and prefixed with {@value #PREFIX}.
 * <p>
 * In the default (truncating) mode two paths sharing their first {@value #MAX_BODY_LENGTH}
 * normalized characters map to the same column, as do paths differing only in separators.
 * The collision-resistant mode keeps the plain name only for paths made of alphanumeric
 * segments joined by single dots that fit unchanged. Any other path gets a digest of the raw
 * path appended, replacing the tail when the name would be too long.
 */
@Getter
@RequiredArgsConstructor
public class ColumnMapper {

    public static final String PREFIX = "k_";
    public static final int MAX_BODY_LENGTH = 48;
    public static final int DIGEST_LENGTH = 8;

    public static final ColumnMapper TRUNCATING = new ColumnMapper(false);
    public static final ColumnMapper COLLISION_RESISTANT = new ColumnMapper(true);

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]+");
    private static final Pattern DOTTED_PATH = Pattern.compile("[a-zA-Z0-9]+(\\.[a-zA-Z0-9]+)*");
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final boolean collisionResistant;

    public static ColumnMapper of(boolean collisionResistant) {
        return collisionResistant ? COLLISION_RESISTANT : TRUNCATING;
    }

    public String mapPath(@NonNull String path) {

        String body = NON_ALPHANUMERIC.matcher(path).replaceAll("_");
        boolean fits = body.length() <= MAX_BODY_LENGTH;

        if (!this.collisionResistant) {
            return PREFIX + (fits ? body : body.substring(0, MAX_BODY_LENGTH));
        }

        if (fits && DOTTED_PATH.matcher(path).matches()) {
            return PREFIX + body;
        }

        int keep = Math.min(body.length(), MAX_BODY_LENGTH - DIGEST_LENGTH - 1);
        return PREFIX + body.substring(0, keep) + "_" + digest(path).substring(0, DIGEST_LENGTH);
    }

    public String mapPath(@NonNull IndexPath path) {
        return this.mapPath(path.getValue());
    }

    public String getMode() {
        return this.collisionResistant ? "digest" : "truncate";
    }

    private static String digest(String value) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            char[] chars = new char[hash.length * 2];
            for (int i = 0; i < hash.length; i++) {
                chars[i * 2] = HEX[(hash[i] >> 4) & 0xf];
                chars[(i * 2) + 1] = HEX[hash[i] & 0xf];
            }
            return new String(chars);
        } catch (NoSuchAlgorithmException exception) {
            throw new IllegalStateException("SHA-256 not available", exception);
        }
    }
}
