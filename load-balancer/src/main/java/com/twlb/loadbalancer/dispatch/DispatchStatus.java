package com.twlb.loadbalancer.dispatch;

/**
 * Result category of one dispatched request.
 */
public enum DispatchStatus {
    SUCCESS("success"),
    /**
     * The node answered with a non-2xx status.
     */
    ERROR_STATUS("error_status"),
    TIMEOUT("timeout"),
    /**
     * Refused, reset or closed before a response arrived.
     */
    CONNECTION_FAILURE("connection_failure");

    private final String tag;

    DispatchStatus(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isFailure() {
        return this != SUCCESS;
    }
}
