package com.fppast.ast;

public enum FloatType implements WireEnum {
    F32("F32", "F32"),
    F64("F64", "F64");

    private final String tag;
    private final String text;

    FloatType(String tag, String text) {
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
