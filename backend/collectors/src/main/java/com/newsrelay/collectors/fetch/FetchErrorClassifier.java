package com.newsrelay.collectors.fetch;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

public final class FetchErrorClassifier {
    private FetchErrorClassifier() {
    }

    public static FetchErrorCode classify(Throwable error) {
        if (error instanceof FetchException fetchException) {
            return fetchException.code();
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof FetchException fetchException) {
                return fetchException.code();
            }
            if (current instanceof HttpConnectTimeoutException) {
                return FetchErrorCode.CONNECTION_ERROR;
            }
            if (current instanceof HttpTimeoutException || current instanceof TimeoutException) {
                return FetchErrorCode.TIMEOUT;
            }
            if (current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof UnresolvedAddressException
                    || current instanceof SSLException) {
                return FetchErrorCode.CONNECTION_ERROR;
            }
        }
        String message = rootMessage(error).toLowerCase(Locale.ROOT);
        if (message.contains("timed out") || message.contains("timeout")) {
            return FetchErrorCode.TIMEOUT;
        }
        if (message.contains("connection") || message.contains("unknownhost") || message.contains("dns")) {
            return FetchErrorCode.CONNECTION_ERROR;
        }
        return FetchErrorCode.FETCH_ERROR;
    }

    public static boolean isSslFailure(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SSLException) {
                return true;
            }
        }
        return false;
    }

    public static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
