package com.fppast.ast;

public enum LiteralBool implements WireEnum {
    TRUE("True", "true"),
    FALSE("False", "false");

    private final String tag;
    private final String text;

    LiteralBool(String tag, String text) {
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
