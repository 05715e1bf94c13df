package org.qroute.ast;

import java.util.Objects;

/**
 * Source location attached to every tree node.
 *
 * <p>Nodes synthesized by a pass inherit the position of the node they replace so
 * downstream diagnostics still point at the originating source line.</p>
 */
public record Position(String file, int line, int column) {
    public static final Position UNKNOWN = new Position("<unknown>", 0, 0);

    public Position {
        file = Objects.requireNonNull(file, "file");
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
