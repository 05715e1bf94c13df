package org.qroute.ast;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Binary arithmetic operators of parameter expressions.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum BinaryOp {
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    POW("^");

    private final String symbol;
}
