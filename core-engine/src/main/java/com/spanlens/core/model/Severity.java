package com.spanlens.core.model;

/**
 * Duration severity of a closed span relative to the other spans of the same
 * batch.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MODERATE,
    HIGH,
    SEVERE
}
