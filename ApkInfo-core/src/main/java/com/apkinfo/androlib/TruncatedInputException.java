package com.apkinfo.androlib;

/**
 * The chunk stream ended in the middle of a chunk, or with open
 * namespaces or elements.
 */
public class TruncatedInputException extends AndrolibException {
    public TruncatedInputException(String message) {
        super(message);
    }

    public TruncatedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
