package info.isaksson.erland.tagcodegen.emitter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Produces the identifier source for one generation pass.
 *
 * <p>Ids must be unique per call site within a rendered tree: a tag used twice on a page gets two ids.
 * Only {@link #random()} is unique across independent renders; the other strategies trade that for
 * reproducible output.</p>
 */
@FunctionalInterface
public interface UniqueIdStrategy {

    UniqueIdSource open(String documentPath);

    static UniqueIdStrategy random() {
        return documentPath -> () -> UUID.randomUUID().toString().replace("-", "");
    }

    static UniqueIdStrategy counter() {
        return documentPath -> {
            int[] next = {0};
            return () -> Integer.toString(++next[0]);
        };
    }

    static UniqueIdStrategy hashed() {
        return documentPath -> {
            String base = documentPath == null ? "" : documentPath;
            int[] index = {0};
            return () -> sha256Hex32(base + "#" + index[0]++);
        };
    }

    static UniqueIdStrategy fixed(String value) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("value must not be blank");
        return documentPath -> () -> value;
    }

    /** SHA-256 truncated to 16 bytes (32 hex chars), the same width as a random id. */
    static String sha256Hex32(String key) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(key.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 16; i++) {
                sb.append(String.format("%02x", digest[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is guaranteed in the JRE.
            throw new IllegalStateException(e);
        }
    }
}
