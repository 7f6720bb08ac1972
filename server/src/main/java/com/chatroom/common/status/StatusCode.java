package com.chatroom.common.status;

/**
 * Status codes shared by the data layer and whatever transport sits on top of it. Each code
 * carries the HTTP status the web layer should answer with.
 */
public enum StatusCode {
    OK(200),
    INVALID_ARGUMENT(400),    // malformed caller input
    NOT_FOUND(404),
    ALREADY_EXISTS(409),      // unique constraint violated
    FAILED_PRECONDITION(409), // referenced row missing (foreign key)
    ABORTED(409),             // serialization failure or deadlock, safe to retry
    UNAVAILABLE(503),         // store unreachable
    INTERNAL(500);

    private final int httpCode;

    StatusCode(int httpCode) {
        this.httpCode = httpCode;
    }

    /**
     * Returns the corresponding HTTP status code.
     */
    public int getHttpCode() {
        return httpCode;
    }

    /**
     * Returns whether this status code represents an error.
     */
    public boolean isError() {
        return this != OK;
    }
}
