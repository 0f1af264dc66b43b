package com.fppast.ast;

public record TypeNameBool() implements TypeName {
}
