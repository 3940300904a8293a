package org.jsondelta.engine;

/**
 * How a node present on only one side is reported.
 */
public enum OneSidedMode {
    /** One Added or Removed record carrying the whole subtree. */
    WHOLE_VALUE,
    /** Records for every leaf of the subtree; empty containers are reported whole. */
    EXPAND
}
