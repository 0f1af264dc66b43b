package com.fppast.ast;

import java.util.Optional;

/**
 * Data product record specifier
 */
public record SpecRecord(
    String name,
    AstNode<TypeName> recordType,
    boolean isArray,
    Optional<AstNode<Expr>> id
) implements ComponentMember.Node {
}
