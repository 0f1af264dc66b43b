package com.fppast.ast;

/**
 * Unary operation
 */
public enum Unop implements WireEnum {
    MINUS("Minus", "-");

    private final String tag;
    private final String text;

    Unop(String tag, String text) {
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
