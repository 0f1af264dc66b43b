package com.fppast.ast;

public record ExprUnop(Unop op, AstNode<Expr> e) implements Expr {
}
