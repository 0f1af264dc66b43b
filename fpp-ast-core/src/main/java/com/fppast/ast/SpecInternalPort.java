package com.fppast.ast;

import java.util.List;
import java.util.Optional;

public record SpecInternalPort(
    String name,
    List<Annotated<AstNode<FormalParam>>> params,
    Optional<AstNode<Expr>> priority,
    Optional<QueueFull> queueFull
) implements ComponentMember.Node {
}
