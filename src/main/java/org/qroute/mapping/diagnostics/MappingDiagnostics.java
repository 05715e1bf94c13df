package org.qroute.mapping.diagnostics;

import org.qroute.ast.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered diagnostic sink shared by device construction and routing.
 *
 * <p>Every report is kept for the caller and also logged. Callers decide whether a
 * non-empty sink means the output must be rejected.</p>
 *
 * <p>This class is NOT thread-safe.</p>
 */
public final class MappingDiagnostics {
    private static final Logger LOG = LoggerFactory.getLogger(MappingDiagnostics.class);

    private final List<MappingDiagnostic> diagnostics = new ArrayList<>();

    public void warn(String reasonCode, String message, Position position) {
        report(new MappingDiagnostic(reasonCode, Severity.WARNING, message, position));
    }

    public void error(String reasonCode, String message, Position position) {
        report(new MappingDiagnostic(reasonCode, Severity.ERROR, message, position));
    }

    /**
     * Records and logs one diagnostic.
     */
    public void report(MappingDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (diagnostic.severity() == Severity.ERROR) {
            LOG.error("{}", diagnostic);
        } else {
            LOG.warn("{}", diagnostic);
        }
    }

    /**
     * Returns an unmodifiable view of all diagnostics in report order.
     */
    public List<MappingDiagnostic> all() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        for (MappingDiagnostic diagnostic : diagnostics) {
            if (diagnostic.severity() == Severity.ERROR) {
                return true;
            }
        }
        return false;
    }

    /**
     * Counts diagnostics carrying the given reason code.
     */
    public int count(String reasonCode) {
        int count = 0;
        for (MappingDiagnostic diagnostic : diagnostics) {
            if (diagnostic.reasonCode().equals(reasonCode)) {
                count++;
            }
        }
        return count;
    }
}
