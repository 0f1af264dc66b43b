package com.fppast.ast;

/**
 * Binary operation
 */
public enum Binop implements WireEnum {
    ADD("Add", "+"),
    DIV("Div", "/"),
    MUL("Mul", "*"),
    SUB("Sub", "-");

    private final String tag;
    private final String text;

    Binop(String tag, String text) {
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
