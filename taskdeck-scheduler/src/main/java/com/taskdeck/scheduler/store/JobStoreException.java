package com.taskdeck.scheduler.store;

/**
 * The job store could not be read or written. Transient from the scheduler's
 * point of view: the poll cycle aborts and the next one retries.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
