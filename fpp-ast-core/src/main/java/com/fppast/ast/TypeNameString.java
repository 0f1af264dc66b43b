package com.fppast.ast;

import java.util.Optional;

public record TypeNameString(Optional<AstNode<Expr>> size) implements TypeName {
}
