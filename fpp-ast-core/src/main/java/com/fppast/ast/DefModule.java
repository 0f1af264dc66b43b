package com.fppast.ast;

import java.util.List;

/**
 * Module definition
 */
public record DefModule(String name, List<ModuleMember> members) implements ModuleMember.Node {
}
