package com.fppast.ast;

/**
 * Constant definition
 */
public record DefConstant(String name, AstNode<Expr> value) implements ModuleMember.Node, ComponentMember.Node {
}
