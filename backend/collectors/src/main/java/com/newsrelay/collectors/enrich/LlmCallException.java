package com.newsrelay.collectors.enrich;

public class LlmCallException extends Exception {
    private final int status;

    public LlmCallException(String message, int status) {
        super(message);
        this.status = status;
    }

    public LlmCallException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int status() {
        return status;
    }
}
