package com.fppast.ast;

import java.util.List;
import java.util.Optional;

/**
 * Struct definition
 */
public record DefStruct(
    String name,
    List<Annotated<AstNode<StructTypeMember>>> members,
    Optional<AstNode<Expr>> defaultValue
) implements ModuleMember.Node, ComponentMember.Node {
}
