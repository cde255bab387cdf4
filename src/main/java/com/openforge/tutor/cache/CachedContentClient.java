package com.openforge.tutor.cache;

import java.time.Duration;

/**
 * Provider endpoint that stores a large static system instruction server-side
 * and hands back a handle that later requests reference instead of resending
 * the text.
 */
public interface CachedContentClient {

    /** Creates a cached instruction set and returns its server handle. */
    String create(String model, String displayName, String systemInstruction, Duration ttl);

    /** Resets the TTL of an existing handle. */
    void renew(String handle, Duration ttl);

    void delete(String handle);

    class CacheClientException extends RuntimeException {
        public CacheClientException(String message) { super(message); }
        public CacheClientException(String message, Throwable cause) { super(message, cause); }
    }
}
