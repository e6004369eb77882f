package com.trustplatform.common.policy;

import com.trustplatform.common.exception.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered collection of {@link ResponsePolicy} instances.
 *
 * <p>Kept sorted by ascending priority; policies with equal priority keep their insertion order.
 * Adding a policy whose id already exists replaces the old one.
 * All access is synchronized on the set; {@link #ordered()} returns a copy.
 */
public class ResponsePolicySet {

    private static final Comparator<ResponsePolicy> BY_PRIORITY =
        Comparator.comparingInt(ResponsePolicy::priority);

    private final List<ResponsePolicy> policies = new ArrayList<>();

    public synchronized void add(ResponsePolicy policy) {
        policies.removeIf(p -> p.policyId().equals(policy.policyId()));
        policies.add(policy);
        policies.sort(BY_PRIORITY);
    }

    /** @return {@code true} if a policy with that id was removed */
    public synchronized boolean remove(String policyId) {
        return policies.removeIf(p -> p.policyId().equals(policyId));
    }

    public synchronized ResponsePolicy get(String policyId) {
        return policies.stream()
            .filter(p -> p.policyId().equals(policyId))
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException("Policy", policyId));
    }

    public synchronized void setEnabled(String policyId, boolean enabled) {
        for (int i = 0; i < policies.size(); i++) {
            if (policies.get(i).policyId().equals(policyId)) {
                policies.set(i, policies.get(i).withEnabled(enabled));
                return;
            }
        }
        throw new ResourceNotFoundException("Policy", policyId);
    }

    /** Snapshot in evaluation order. */
    public synchronized List<ResponsePolicy> ordered() {
        return List.copyOf(policies);
    }

    public synchronized int size() {
        return policies.size();
    }
}
