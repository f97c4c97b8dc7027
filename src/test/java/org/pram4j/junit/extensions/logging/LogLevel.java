package org.pram4j.junit.extensions.logging;

/**
 * Log levels that tests can allow, expect or fail on.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
