package com.fppast.ast;

public record PortInstanceIdentifier(AstNode<QualIdent> componentInstance, AstNode<String> portName) {
}
