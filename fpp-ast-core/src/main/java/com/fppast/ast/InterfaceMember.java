package com.fppast.ast;

/**
 * Member of a port interface definition
 */
public record InterfaceMember(Annotated<AstNode<InterfaceMember.Node>> node) {

    public sealed interface Node permits
        SpecImport,
        SpecPortInstance {
    }
}
