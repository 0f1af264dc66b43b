package com.fppast.ast;

/**
 * Kind of a connection pattern
 */
public enum PatternKind implements WireEnum {
    COMMAND("Command", "command"),
    EVENT("Event", "event"),
    HEALTH("Health", "health"),
    PARAM("Param", "param"),
    TELEMETRY("Telemetry", "telemetry"),
    TEXT_EVENT("TextEvent", "text event"),
    TIME("Time", "time");

    private final String tag;
    private final String text;

    PatternKind(String tag, String text) {
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
