package com.fotofun.eventbus;

/**
 * What the bus does with a failing handler or a refused registration.
 */
public enum ErrorPolicy {
    /** Log the error and carry on. */
    LOG,
    /** Raise after every sibling handler has run (or immediately, for registrations). */
    THROW,
    /** Carry on silently. */
    IGNORE
}
