package com.fppast.ast;

/**
 * Member of a telemetry packet set
 */
public record TlmPacketSetMember(Annotated<AstNode<TlmPacketSetMember.Node>> node) {

    public sealed interface Node permits
        SpecTlmPacket {
    }
}
