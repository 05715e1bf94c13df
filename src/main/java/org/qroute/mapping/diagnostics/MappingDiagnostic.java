package org.qroute.mapping.diagnostics;

import org.qroute.ast.Position;

import java.util.Objects;

/**
 * One reason-coded message reported on the diagnostic side channel.
 *
 * @param reasonCode deterministic reason code.
 * @param severity severity level.
 * @param message human-readable description.
 * @param position source position, or {@link Position#UNKNOWN} for device-level problems.
 */
public record MappingDiagnostic(String reasonCode, Severity severity, String message, Position position) {

    public MappingDiagnostic {
        reasonCode = Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        severity = Objects.requireNonNull(severity, "severity");
        message = Objects.requireNonNull(message, "message");
        position = position == null ? Position.UNKNOWN : position;
    }

    @Override
    public String toString() {
        return severity + " [" + reasonCode + "] " + position + ": " + message;
    }
}
