package com.inferdispatch.scheduler.dispatch;

/**
 * Thrown when a request cannot be dispatched because no eligible instance exists.
 * <p>
 * The caller decides whether to retry or queue the request.
 * </p>
 */
public class NoAvailableInstanceException extends DispatchSchedulerException {

    public NoAvailableInstanceException(String message) {
        super(message);
    }
}
