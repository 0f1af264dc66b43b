package com.fppast.ast;

import java.util.Optional;

/**
 * Data product container specifier
 */
public record SpecContainer(
    String name,
    Optional<AstNode<Expr>> id,
    Optional<AstNode<Expr>> defaultPriority
) implements ComponentMember.Node {
}
