package com.newsrelay.core.model;

public enum RejectReason {
    OLD_PUBLISHED_AT("old-published-at"),
    NO_PUBLISHED_DATE("no-published-date"),
    PARSE_DATE_FAILED("parse-date-failed"),
    TOO_SHORT("too-short"),
    LOW_QUALITY("low-quality"),
    DUPLICATE_SEEN("duplicate-seen"),
    DUPLICATE_URL("duplicate-url"),
    DUPLICATE_CHECKSUM("duplicate-checksum"),
    DUPLICATE_SIMHASH("duplicate-simhash"),
    DUPLICATE_TITLE("duplicate-title"),
    PERSIST_FAILED("persist-failed");

    private final String code;

    RejectReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isDuplicate() {
        return code.startsWith("duplicate-");
    }
}
