package com.fppast.ast;

public record ExprLiteralFloat(String value) implements Expr {
}
