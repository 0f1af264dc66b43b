package com.fppast.ast;

import java.util.List;
import java.util.Optional;

public record SpecTlmPacket(
    String name,
    Optional<AstNode<Expr>> id,
    AstNode<Expr> group,
    List<AstNode<TlmPacketMember>> members
) implements TlmPacketSetMember.Node {
}
