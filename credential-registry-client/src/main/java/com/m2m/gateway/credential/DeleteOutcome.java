package com.m2m.gateway.credential;

/**
 * Result of a delete. A missing record is a normal outcome, not an error.
 */
public enum DeleteOutcome {
    DELETED,
    NOT_FOUND
}
