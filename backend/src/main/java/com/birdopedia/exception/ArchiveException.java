package com.birdopedia.exception;

/**
 * Raised when archive files (capture manifest, trips output) cannot be read or written.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
