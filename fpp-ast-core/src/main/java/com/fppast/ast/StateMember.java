package com.fppast.ast;

/**
 * Member of a state definition
 */
public record StateMember(Annotated<AstNode<StateMember.Node>> node) {

    public sealed interface Node permits
        DefChoice,
        DefState,
        SpecInitialTransition,
        SpecStateEntry,
        SpecStateExit,
        SpecStateTransition {
    }
}
