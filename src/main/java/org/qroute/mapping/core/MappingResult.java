package org.qroute.mapping.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.qroute.ast.Program;
import org.qroute.mapping.diagnostics.MappingDiagnostic;
import org.qroute.mapping.diagnostics.Severity;

import java.util.List;

/**
 * Outcome of one mapping run.
 *
 * <p>The program is the same instance that was passed in, rewritten in place. When
 * {@code diagnostics} contains an ERROR the program is best-effort output and should
 * not be sent to hardware.</p>
 */
@Value
@Builder
public class MappingResult {
    /** Rewritten program. */
    Program program;
    /** Final logical-to-physical correspondence after all inserted swaps. */
    Permutation permutation;
    /** Diagnostics reported during the run, in report order. */
    @Singular
    List<MappingDiagnostic> diagnostics;
    /** Number of swaps inserted. */
    int swapsInserted;
    /** Number of CNOTs emitted with a basis-change sandwich because only the reverse direction is coupled. */
    int directionCorrections;

    /**
     * Returns whether no ERROR diagnostic was reported.
     */
    public boolean isHardwareValid() {
        for (MappingDiagnostic diagnostic : diagnostics) {
            if (diagnostic.severity() == Severity.ERROR) {
                return false;
            }
        }
        return true;
    }
}
