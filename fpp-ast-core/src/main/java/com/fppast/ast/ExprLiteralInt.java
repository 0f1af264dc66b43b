package com.fppast.ast;

/**
 * Integer literal, kept in its source spelling
 */
public record ExprLiteralInt(String value) implements Expr {
}
