package com.fppast.ast;

import java.util.List;

/**
 * Component definition
 */
public record DefComponent(
    ComponentKind kind,
    String name,
    List<ComponentMember> members
) implements ModuleMember.Node {
}
