package com.shardstore.migration.infrastructure.persistence;

import com.shardstore.migration.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encodes keyset positions as opaque continuation tokens.
 */
public final class ContinuationTokens {
    
    private static final String PREFIX = "after:";
    
    private static final String RETRY_PASS = "retry:";
    
    private ContinuationTokens() {
        // Utility class - prevent instantiation
    }
    
    public static String encode(String lastId) {
        byte[] raw = (PREFIX + lastId).getBytes(StandardCharsets.UTF_8);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
    }
    
    /**
     * Token of the pass that re-attempts records deferred by a concurrent write.
     */
    public static String retryPass() {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(RETRY_PASS.getBytes(StandardCharsets.UTF_8));
    }
    
    public static boolean isRetryPass(String token) {
        return retryPass().equals(token);
    }
    
    /**
     * Decode a token into the last processed ID. A blank token means "from the start".
     *
     * @throws ValidationException if the token was not produced by {@link #encode(String)}
     */
    public static String decode(String token) {
        if (StringUtils.isBlank(token)) {
            return "";
        }
        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed continuation token: " + token);
        }
        if (!decoded.startsWith(PREFIX)) {
            throw new ValidationException("Malformed continuation token: " + token);
        }
        return decoded.substring(PREFIX.length());
    }
}
