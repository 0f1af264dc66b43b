package com.fppast.ast;

public record SpecCompInstance(Visibility visibility, AstNode<QualIdent> instance) implements TopologyMember.Node {
}
