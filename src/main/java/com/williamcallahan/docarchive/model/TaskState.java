package com.williamcallahan.docarchive.model;

/**
 * Lifecycle states reported by the task queue for a background task.
 */
public enum TaskState {
    PENDING,
    RECEIVED,
    STARTED,
    SUCCESS,
    FAILURE,
    REVOKED,
    REJECTED,
    RETRY,
    IGNORED;

    public boolean isReady() {
        return this == SUCCESS || this == FAILURE || this == REVOKED;
    }
}
