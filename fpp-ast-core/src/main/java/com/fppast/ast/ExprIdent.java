package com.fppast.ast;

public record ExprIdent(String value) implements Expr {
}
