package com.fppast.ast;

import java.util.Optional;

/**
 * Parameter specifier
 */
public record SpecParam(
    String name,
    AstNode<TypeName> typeName,
    Optional<AstNode<Expr>> defaultValue,
    Optional<AstNode<Expr>> id,
    Optional<AstNode<Expr>> setOpcode,
    Optional<AstNode<Expr>> saveOpcode,
    boolean isExternal
) implements ComponentMember.Node {
}
