package com.fppast.ast;

public record DefChoice(
    String name,
    AstNode<String> guard,
    AstNode<TransitionExpr> ifTransition,
    AstNode<TransitionExpr> elseTransition
) implements StateMachineMember.Node, StateMember.Node {
}
