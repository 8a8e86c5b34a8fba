package com.sankeydsl.loader;

/**
 * Checked exception signalling that flow text could not be read. Malformed content is never
 * reported this way; only I/O failures are.
 */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
