package org.qroute.mapping.device;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Fatal device construction failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with the reason code, for example
 * {@code [DEVICE_INVALID_QUBIT_COUNT] ...}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class DeviceException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded construction failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public DeviceException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
