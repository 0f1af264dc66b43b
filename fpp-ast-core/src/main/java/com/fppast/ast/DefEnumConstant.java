package com.fppast.ast;

import java.util.Optional;

public record DefEnumConstant(String name, Optional<AstNode<Expr>> value) {
}
