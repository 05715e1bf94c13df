package org.qroute.mapping.diagnostics;

/**
 * Diagnostic severity. Neither level aborts the call that reported it.
 */
public enum Severity {
    /** Input was partially ignored; the result is still usable. */
    WARNING,
    /** The result is not guaranteed to be hardware-valid. */
    ERROR
}
