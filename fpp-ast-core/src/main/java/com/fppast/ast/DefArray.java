package com.fppast.ast;

import java.util.Optional;

/**
 * Array definition
 */
public record DefArray(
    String name,
    AstNode<Expr> size,
    AstNode<TypeName> eltType,
    Optional<AstNode<Expr>> defaultValue,
    Optional<AstNode<String>> format
) implements ModuleMember.Node, ComponentMember.Node {
}
