package com.fppast.ast;

public record TypeNameInt(IntType name) implements TypeName {
}
