package com.eyelevel.renamedclient.job;

/**
 * Called once per status query while waiting for a job. Exceptions thrown here are logged and ignored.
 */
@FunctionalInterface
public interface ProgressObserver {

    void onProgress(JobStatusSnapshot snapshot);
}
