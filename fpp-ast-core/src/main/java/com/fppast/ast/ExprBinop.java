package com.fppast.ast;

public record ExprBinop(
    AstNode<Expr> e1,
    Binop op,
    AstNode<Expr> e2
) implements Expr {
}
