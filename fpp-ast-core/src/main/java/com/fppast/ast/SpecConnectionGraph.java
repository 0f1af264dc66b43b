package com.fppast.ast;

import java.util.List;

/**
 * Connection graph specifier
 */
public sealed interface SpecConnectionGraph extends TopologyMember.Node
    permits SpecConnectionGraph.Direct, SpecConnectionGraph.Pattern {

    record Direct(String name, List<Connection> connections) implements SpecConnectionGraph {
    }

    record Pattern(
        PatternKind kind,
        AstNode<QualIdent> source,
        List<AstNode<QualIdent>> targets
    ) implements SpecConnectionGraph {
    }
}
