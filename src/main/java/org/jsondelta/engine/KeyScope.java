package org.jsondelta.engine;

/**
 * Granularity at which identity keys are chosen.
 */
public enum KeyScope {
    /** Every array location is analyzed on its own. */
    LOCATION,
    /**
     * The key found for the first array of an array pattern is reused by every later array of the
     * same pattern it fits; arrays it does not fit are analyzed on their own.
     */
    PATTERN
}
