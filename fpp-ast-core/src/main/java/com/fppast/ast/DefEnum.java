package com.fppast.ast;

import java.util.List;
import java.util.Optional;

/**
 * Enum definition
 */
public record DefEnum(
    String name,
    Optional<AstNode<TypeName>> typeName,
    List<Annotated<AstNode<DefEnumConstant>>> constants,
    Optional<AstNode<Expr>> defaultValue
) implements ModuleMember.Node, ComponentMember.Node {
}
