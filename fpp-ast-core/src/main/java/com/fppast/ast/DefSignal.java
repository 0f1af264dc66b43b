package com.fppast.ast;

import java.util.Optional;

public record DefSignal(String name, Optional<AstNode<TypeName>> typeName) implements StateMachineMember.Node {
}
