package com.fppast.ast;

/**
 * A telemetry limit
 */
public record Limit(AstNode<LimitKind> kind, AstNode<Expr> value) {
}
