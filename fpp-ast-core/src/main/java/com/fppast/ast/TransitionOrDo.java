package com.fppast.ast;

import java.util.List;

/**
 * The effect of a state transition specifier: either a transition to a target or a list of
 * actions run without leaving the state.
 */
public sealed interface TransitionOrDo permits TransitionOrDo.Transition, TransitionOrDo.Do {

    record Transition(AstNode<TransitionExpr> transition) implements TransitionOrDo {
    }

    record Do(List<AstNode<String>> actions) implements TransitionOrDo {
    }
}
