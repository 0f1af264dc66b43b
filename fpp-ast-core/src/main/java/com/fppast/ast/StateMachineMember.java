package com.fppast.ast;

/**
 * Member of a state machine definition
 */
public record StateMachineMember(Annotated<AstNode<StateMachineMember.Node>> node) {

    public sealed interface Node permits
        DefAction,
        DefChoice,
        DefGuard,
        DefSignal,
        DefState,
        SpecInitialTransition {
    }
}
