package com.fppast.ast;

/**
 * Alias type definition
 */
public record DefAliasType(String name, AstNode<TypeName> typeName) implements ModuleMember.Node, ComponentMember.Node {
}
