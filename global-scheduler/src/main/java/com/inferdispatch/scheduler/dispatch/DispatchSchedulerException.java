package com.inferdispatch.scheduler.dispatch;

/**
 * Base type of the structural failures reported by the dispatch scheduler.
 */
public class DispatchSchedulerException extends RuntimeException {

    public DispatchSchedulerException(String message) {
        super(message);
    }
}
