package org.qroute.ast;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Unary operators and built-in functions of parameter expressions.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum UnaryOp {
    NEG("-"),
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    EXP("exp"),
    LN("ln"),
    SQRT("sqrt");

    private final String symbol;
}
