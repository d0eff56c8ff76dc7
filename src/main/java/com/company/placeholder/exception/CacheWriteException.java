package com.company.placeholder.exception;

public class CacheWriteException extends RuntimeException {
    public CacheWriteException(String placeholderId, Throwable cause) {
        super("Failed to write cache version for placeholder " + placeholderId, cause);
    }
}
