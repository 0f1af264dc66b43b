package com.fppast.ast;

public enum Visibility implements WireEnum {
    PRIVATE("Private", "private"),
    PUBLIC("Public", "public");

    private final String tag;
    private final String text;

    Visibility(String tag, String text) {
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
