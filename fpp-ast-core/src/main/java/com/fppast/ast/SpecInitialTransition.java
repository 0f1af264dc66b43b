package com.fppast.ast;

public record SpecInitialTransition(AstNode<TransitionExpr> transition) implements StateMachineMember.Node, StateMember.Node {
}
