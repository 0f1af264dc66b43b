package com.fppast.ast;

/**
 * Behavior of a full input queue
 */
public enum QueueFull implements WireEnum {
    ASSERT("Assert", "assert"),
    BLOCK("Block", "block"),
    DROP("Drop", "drop"),
    HOOK("Hook", "hook");

    private final String tag;
    private final String text;

    QueueFull(String tag, String text) {
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
