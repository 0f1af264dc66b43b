package com.fppast.ast;

public record ExprDot(AstNode<Expr> e, AstNode<String> id) implements Expr {
}
