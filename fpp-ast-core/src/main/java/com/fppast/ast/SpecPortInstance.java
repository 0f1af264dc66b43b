package com.fppast.ast;

import java.util.Optional;

/**
 * Port instance specifier
 */
public sealed interface SpecPortInstance extends ComponentMember.Node, InterfaceMember.Node
    permits SpecPortInstance.General, SpecPortInstance.Special {

    String name();

    record General(
        GeneralKind kind,
        String name,
        Optional<AstNode<Expr>> size,
        Optional<AstNode<QualIdent>> port,
        Optional<AstNode<Expr>> priority,
        Optional<AstNode<QueueFull>> queueFull
    ) implements SpecPortInstance {
    }

    record Special(
        Optional<SpecialInputKind> inputKind,
        SpecialKind kind,
        String name,
        Optional<AstNode<Expr>> priority,
        Optional<AstNode<QueueFull>> queueFull
    ) implements SpecPortInstance {
    }
}
