package com.fppast.ast;

import java.util.Optional;

/**
 * Member of a struct definition
 */
public record StructTypeMember(
    String name,
    Optional<AstNode<Expr>> size,
    AstNode<TypeName> typeName,
    Optional<AstNode<String>> format
) {
}
