package com.david.spring.log.dispatch.model;

/** Fixed classification of a log message; decides which handler claims it. */
public enum Severity {
    /** Written to the diagnostic stream */
    WARNING,
    /** Persisted to the configured error file */
    ERROR,
    /** Aborts processing */
    FATAL_ERROR,
    /** Claimed by the catch-all handler, which aborts processing */
    UNCLASSIFIED
}
