package com.fppast.ast;

import java.util.List;

public record ExprStruct(List<AstNode<StructMember>> members) implements Expr {
}
