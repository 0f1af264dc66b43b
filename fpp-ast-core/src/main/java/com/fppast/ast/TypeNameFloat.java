package com.fppast.ast;

public record TypeNameFloat(FloatType name) implements TypeName {
}
