package com.eyelevel.renamedclient.job;

/**
 * Client-side state of a {@link JobPoller}. Every state but {@code POLLING} is final.
 */
public enum JobState {
    POLLING,
    COMPLETED,
    FAILED,
    TIMED_OUT,
    CANCELLED
}
