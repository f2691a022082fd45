package com.newsrelay.collectors.fetch;

import java.util.Objects;

public record FetchErrorCode(String value, int httpStatus) {
    public static final FetchErrorCode TIMEOUT = new FetchErrorCode("TIMEOUT", 0);
    public static final FetchErrorCode CONNECTION_ERROR = new FetchErrorCode("CONNECTION_ERROR", 0);
    public static final FetchErrorCode PARSE_ERROR = new FetchErrorCode("PARSE_ERROR", 0);
    public static final FetchErrorCode FETCH_ERROR = new FetchErrorCode("FETCH_ERROR", 0);

    public FetchErrorCode {
        Objects.requireNonNull(value, "value is required");
    }

    public static FetchErrorCode http(int status) {
        return new FetchErrorCode("HTTP_" + status, status);
    }

    public boolean isHttp(int status) {
        return httpStatus == status;
    }

    @Override
    public String toString() {
        return value;
    }
}
