package com.fppast.ast;

import java.util.Optional;

public record SpecStateMachineInstance(
    String name,
    AstNode<QualIdent> stateMachine,
    Optional<AstNode<Expr>> priority,
    Optional<QueueFull> queueFull
) implements ComponentMember.Node {
}
