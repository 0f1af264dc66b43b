package com.fppast.ast;

import java.util.List;

/**
 * Port interface definition
 */
public record DefInterface(String name, List<InterfaceMember> members) implements ModuleMember.Node {
}
