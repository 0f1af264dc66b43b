package com.fppast.ast;

/**
 * Member of a topology definition
 */
public record TopologyMember(Annotated<AstNode<TopologyMember.Node>> node) {

    public sealed interface Node permits
        SpecCompInstance,
        SpecConnectionGraph,
        SpecImport,
        SpecTlmPacketSet {
    }
}
