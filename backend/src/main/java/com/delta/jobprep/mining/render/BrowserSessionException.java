package com.delta.jobprep.mining.render;

public class BrowserSessionException extends RuntimeException {
    public BrowserSessionException(String message) {
        super(message);
    }

    public BrowserSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
