package com.marginledger.api;

/**
 * Request headers understood by the REST layer.
 */
public final class ApiHeaders {

    /** Identity of the calling account, as established by the fronting gateway. */
    public static final String CALLER = "X-Account";

    private ApiHeaders() {}
}
