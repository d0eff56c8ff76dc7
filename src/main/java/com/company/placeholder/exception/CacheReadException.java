package com.company.placeholder.exception;

public class CacheReadException extends RuntimeException {
    public CacheReadException(String cacheKey, Throwable cause) {
        super("Failed to read cache entry " + cacheKey, cause);
    }
}
