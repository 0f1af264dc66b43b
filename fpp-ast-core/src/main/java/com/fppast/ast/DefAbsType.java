package com.fppast.ast;

/**
 * Abstract type definition
 */
public record DefAbsType(String name) implements ModuleMember.Node, ComponentMember.Node {
}
