package com.fppast.ast;

import java.util.Optional;

public record SpecStateTransition(
    AstNode<String> signal,
    Optional<AstNode<String>> guard,
    TransitionOrDo transitionOrDo
) implements StateMember.Node {
}
