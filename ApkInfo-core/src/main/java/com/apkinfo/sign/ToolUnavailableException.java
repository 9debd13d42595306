package com.apkinfo.sign;

import com.apkinfo.androlib.AndrolibException;

/**
 * The external certificate tool could not be started, timed out or exited
 * with an error.
 */
public class ToolUnavailableException extends AndrolibException {

    public ToolUnavailableException(String message) {
        super(message);
    }

    public ToolUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
