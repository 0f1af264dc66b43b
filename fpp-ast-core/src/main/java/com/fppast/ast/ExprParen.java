package com.fppast.ast;

public record ExprParen(AstNode<Expr> e) implements Expr {
}
