package com.fppast.ast;

/**
 * Input kind of a special port instance
 */
public enum SpecialInputKind implements WireEnum {
    ASYNC("Async", "async"),
    GUARDED("Guarded", "guarded"),
    SYNC("Sync", "sync");

    private final String tag;
    private final String text;

    SpecialInputKind(String tag, String text) {
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
