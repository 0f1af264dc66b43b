package com.fppast.ast;

public record TlmChannelIdentifier(AstNode<QualIdent> componentInstance, AstNode<String> channelName) implements TlmPacketMember {
}
