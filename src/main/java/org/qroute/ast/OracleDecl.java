package org.qroute.ast;

import java.util.List;
import java.util.Objects;

/**
 * Oracle declaration backed by an external logic file.
 */
public record OracleDecl(Position pos, String id, List<String> params, String fileName) implements Stmt {

    public OracleDecl {
        pos = Objects.requireNonNull(pos, "pos");
        id = Objects.requireNonNull(id, "id");
        params = List.copyOf(params);
        fileName = Objects.requireNonNull(fileName, "fileName");
    }

    @Override
    public StmtKind kind() {
        return StmtKind.ORACLE_DECL;
    }

    @Override
    public String toString() {
        return "oracle " + id + " " + String.join(",", params) + " { \"" + fileName + "\" }";
    }
}
