package com.fieldops.database.isolation;

/**
 * Thrown when the isolation layer is misconfigured or misused in a way detected before any
 * connection is borrowed: a missing session context, an audience this propagator may not serve,
 * a role name that is not a plain SQL identifier, or row policies that drifted from the catalog.
 */
public class IsolationConfigurationException extends RuntimeException {

    public IsolationConfigurationException(String message) {
        super(message);
    }
}
