package com.inferdispatch.scheduler.dispatch;

import lombok.Getter;

import java.util.Collection;

/**
 * Thrown at scheduler construction when the configured dispatch policy name is not registered.
 */
@Getter
public class UnknownPolicyException extends DispatchSchedulerException {

    private final String policyName;

    public UnknownPolicyException(String policyName, Collection<String> knownPolicies) {
        super("Unknown dispatch policy '" + policyName + "', expected one of " + knownPolicies);
        this.policyName = policyName;
    }
}
