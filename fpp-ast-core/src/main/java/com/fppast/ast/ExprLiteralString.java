package com.fppast.ast;

public record ExprLiteralString(String value) implements Expr {
}
