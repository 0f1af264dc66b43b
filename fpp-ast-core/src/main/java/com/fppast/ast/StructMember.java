package com.fppast.ast;

/**
 * Member of a struct expression
 */
public record StructMember(String name, AstNode<Expr> value) {
}
