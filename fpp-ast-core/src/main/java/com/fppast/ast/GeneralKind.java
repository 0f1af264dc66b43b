package com.fppast.ast;

/**
 * Kind of a general port instance
 */
public enum GeneralKind implements WireEnum {
    ASYNC_INPUT("AsyncInput", "async input"),
    GUARDED_INPUT("GuardedInput", "guarded input"),
    OUTPUT("Output", "output"),
    SYNC_INPUT("SyncInput", "sync input");

    private final String tag;
    private final String text;

    GeneralKind(String tag, String text) {
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
