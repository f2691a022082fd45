package com.newsrelay.collectors.fetch;

public class FetchException extends Exception {
    private final FetchErrorCode code;

    public FetchException(FetchErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public FetchException(FetchErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public FetchErrorCode code() {
        return code;
    }
}
