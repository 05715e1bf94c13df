package org.qroute.ast;

import java.util.List;
import java.util.Objects;

/**
 * User gate declaration. Normally eliminated by inlining before hardware mapping.
 */
public record GateDecl(
        Position pos,
        String id,
        boolean opaque,
        List<String> classicalParams,
        List<String> quantumParams,
        List<Gate> body
) implements Stmt {

    public GateDecl {
        pos = Objects.requireNonNull(pos, "pos");
        id = Objects.requireNonNull(id, "id");
        classicalParams = List.copyOf(classicalParams);
        quantumParams = List.copyOf(quantumParams);
        body = List.copyOf(body);
    }

    /**
     * Returns a copy with another body, keeping the signature.
     */
    public GateDecl withBody(List<Gate> newBody) {
        return new GateDecl(pos, id, opaque, classicalParams, quantumParams, newBody);
    }

    @Override
    public StmtKind kind() {
        return StmtKind.GATE_DECL;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(opaque ? "opaque " : "gate ").append(id);
        if (!classicalParams.isEmpty()) {
            sb.append('(').append(String.join(",", classicalParams)).append(')');
        }
        sb.append(' ').append(String.join(",", quantumParams));
        if (opaque) {
            return sb.append(';').toString();
        }
        sb.append(" {");
        for (Gate gate : body) {
            sb.append(' ').append(gate);
        }
        return sb.append(" }").toString();
    }
}
