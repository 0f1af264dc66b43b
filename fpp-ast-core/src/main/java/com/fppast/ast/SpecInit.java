package com.fppast.ast;

/**
 * Init specifier of a component instance
 */
public record SpecInit(AstNode<Expr> phase, String code) {
}
