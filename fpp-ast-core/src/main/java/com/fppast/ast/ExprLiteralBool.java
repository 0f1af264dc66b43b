package com.fppast.ast;

public record ExprLiteralBool(LiteralBool value) implements Expr {
}
