package com.fppast.ast;

public record TypeNameQualIdent(AstNode<QualIdent> name) implements TypeName {
}
