package com.fppast.ast;

import java.util.List;

public record ExprArray(List<AstNode<Expr>> elts) implements Expr {
}
