package com.fppast.ast;

public sealed interface TypeName permits
    TypeNameBool,
    TypeNameFloat,
    TypeNameInt,
    TypeNameQualIdent,
    TypeNameString {
}
