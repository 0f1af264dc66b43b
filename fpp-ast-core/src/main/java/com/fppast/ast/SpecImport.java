package com.fppast.ast;

/**
 * Import of an interface into a component or interface, or of a topology into a topology
 */
public record SpecImport(AstNode<QualIdent> sym) implements ComponentMember.Node, InterfaceMember.Node, TopologyMember.Node {
}
