package com.marginledger.access;

import java.util.Collection;
import java.util.Set;

/**
 * {@link AccessPolicy} backed by the executor list from {@code ledger.executors}.
 */
public class ConfiguredAccessPolicy implements AccessPolicy {

    private final Set<String> executors;

    public ConfiguredAccessPolicy(Collection<String> executors) {
        this.executors = Set.copyOf(executors);
    }

    @Override
    public boolean isExecutor(String caller) {
        return caller != null && executors.contains(caller);
    }
}
