package com.fppast.ast;

import java.util.List;

public record TransitionExpr(List<AstNode<String>> actions, AstNode<QualIdent> target) {
}
