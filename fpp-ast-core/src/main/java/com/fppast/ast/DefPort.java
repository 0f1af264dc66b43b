package com.fppast.ast;

import java.util.List;
import java.util.Optional;

/**
 * Port definition
 */
public record DefPort(
    String name,
    List<Annotated<AstNode<FormalParam>>> params,
    Optional<AstNode<TypeName>> returnType
) implements ModuleMember.Node {
}
