package com.inferdispatch.scheduler.dispatch.policy;

import com.inferdispatch.scheduler.dispatch.UnknownPolicyException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;

/**
 * Resolves configured policy names to fresh {@link DispatchPolicy} instances.
 */
public final class DispatchPolicyRegistry {
    private DispatchPolicyRegistry() {
    }

    private static final Map<String, Function<Random, DispatchPolicy>> POLICIES = new LinkedHashMap<>();

    static {
        POLICIES.put(FloodPolicy.NAME, random -> new FloodPolicy());
        POLICIES.put(BalancedPolicy.NAME, random -> new BalancedPolicy());
        POLICIES.put(LoadPolicy.NAME, random -> new LoadPolicy());
        POLICIES.put(QueuePolicy.NAME, QueuePolicy::new);
        POLICIES.put(RoundRobinPolicy.NAME, random -> new RoundRobinPolicy());
    }

    /**
     * Creates a new policy instance. Stateful policies never share state between schedulers.
     *
     * @param policyName Registry name, matched exactly
     * @param random     Random source for policies with random tie-breaks
     * @return New policy
     * @throws UnknownPolicyException if the name is not registered
     */
    public static DispatchPolicy create(String policyName, Random random) {
        Function<Random, DispatchPolicy> factory = POLICIES.get(policyName);
        if (factory == null) {
            throw new UnknownPolicyException(policyName, names());
        }
        return factory.apply(random);
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(POLICIES.keySet());
    }
}
