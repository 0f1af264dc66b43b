package com.fppast.ast;

/**
 * Component kind
 */
public enum ComponentKind implements WireEnum {
    ACTIVE("Active", "active"),
    PASSIVE("Passive", "passive"),
    QUEUED("Queued", "queued");

    private final String tag;
    private final String text;

    ComponentKind(String tag, String text) {
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
