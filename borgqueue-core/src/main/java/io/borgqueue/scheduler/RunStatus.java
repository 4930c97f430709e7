package io.borgqueue.scheduler;

/**
 * Last known outcome of a backup target's scheduled run.
 */
public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILURE,
    CANCELLED
}
