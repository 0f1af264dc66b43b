package com.fppast.ast;

public enum LimitKind implements WireEnum {
    RED("Red", "red"),
    ORANGE("Orange", "orange"),
    YELLOW("Yellow", "yellow");

    private final String tag;
    private final String text;

    LimitKind(String tag, String text) {
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
