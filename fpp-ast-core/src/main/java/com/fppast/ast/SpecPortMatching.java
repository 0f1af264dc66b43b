package com.fppast.ast;

public record SpecPortMatching(AstNode<String> port1, AstNode<String> port2) implements ComponentMember.Node {
}
