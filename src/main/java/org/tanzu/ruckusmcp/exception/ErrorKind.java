package org.tanzu.ruckusmcp.exception;

/**
 * Categories a failed RUCKUS One call is classified into.
 */
public enum ErrorKind {
    AUTHENTICATION,
    NOT_FOUND,
    VALIDATION,
    RATE_LIMIT,
    SERVER,
    GENERIC
}
