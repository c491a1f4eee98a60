package com.marginledger.access;

import com.marginledger.exception.NotAuthorizedException;

/**
 * Access-control predicates consumed by every mutating ledger operation.
 *
 * <p>Role storage (owner, executor rotation) is managed outside the ledger; this
 * interface only answers "is this caller the executor" and "does this caller own the
 * record". The default methods turn the predicates into fail-fast checks.
 */
public interface AccessPolicy {

    boolean isExecutor(String caller);

    default boolean isOwner(String caller, String owner) {
        return caller != null && caller.equals(owner);
    }

    default void requireExecutor(String caller, String operation) {
        if (!isExecutor(caller)) {
            throw new NotAuthorizedException(
                    String.format("Caller %s is not an authorized executor for %s", caller, operation));
        }
    }

    default void requireOwnerOrExecutor(String caller, String owner, String operation) {
        if (!isOwner(caller, owner) && !isExecutor(caller)) {
            throw new NotAuthorizedException(
                    String.format("Caller %s is neither owner nor executor for %s", caller, operation));
        }
    }
}
