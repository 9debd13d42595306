package com.apkinfo.androlib;

/**
 * The input is not what it claims to be: wrong file extension, missing
 * manifest, malformed chunk header or unbalanced xml nesting.
 */
public class FormatException extends AndrolibException {
    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
