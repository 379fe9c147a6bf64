package com.inferdispatch.scheduler.dispatch;

import lombok.Getter;

/**
 * Thrown when removing an instance the scheduler never registered.
 */
@Getter
public class InstanceNotFoundException extends DispatchSchedulerException {

    private final String instanceId;

    public InstanceNotFoundException(String instanceId) {
        super("Instance " + instanceId + " is not registered");
        this.instanceId = instanceId;
    }
}
