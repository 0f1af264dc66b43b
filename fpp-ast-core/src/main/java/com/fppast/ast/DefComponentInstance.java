package com.fppast.ast;

import java.util.List;
import java.util.Optional;

/**
 * Component instance definition
 */
public record DefComponentInstance(
    String name,
    AstNode<QualIdent> component,
    AstNode<Expr> baseId,
    Optional<AstNode<String>> implType,
    Optional<AstNode<String>> file,
    Optional<AstNode<Expr>> queueSize,
    Optional<AstNode<Expr>> stackSize,
    Optional<AstNode<Expr>> priority,
    Optional<AstNode<Expr>> cpu,
    List<Annotated<AstNode<SpecInit>>> initSpecs
) implements ModuleMember.Node {
}
