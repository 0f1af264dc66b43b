package com.fppast.ast;

import java.util.List;

/**
 * Telemetry packet set specifier
 */
public record SpecTlmPacketSet(
    String name,
    List<TlmPacketSetMember> members,
    List<AstNode<TlmChannelIdentifier>> omitted
) implements TopologyMember.Node {
}
