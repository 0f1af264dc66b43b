package com.fppast.ast;

public enum IntType implements WireEnum {
    I8("I8", "I8"),
    I16("I16", "I16"),
    I32("I32", "I32"),
    I64("I64", "I64"),
    U8("U8", "U8"),
    U16("U16", "U16"),
    U32("U32", "U32"),
    U64("U64", "U64");

    private final String tag;
    private final String text;

    IntType(String tag, String text) {
        this.tag = tag;
        this.text = text;
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return text;
    }
}
