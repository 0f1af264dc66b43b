package com.fppast.ast;

import java.util.List;
import java.util.Optional;

/**
 * Event specifier
 */
public record SpecEvent(
    String name,
    List<Annotated<AstNode<FormalParam>>> params,
    Severity severity,
    Optional<AstNode<Expr>> id,
    AstNode<String> format,
    Optional<AstNode<Expr>> throttle
) implements ComponentMember.Node {

    public enum Severity implements WireEnum {
        ACTIVITY_HIGH("ActivityHigh", "activity high"),
        ACTIVITY_LOW("ActivityLow", "activity low"),
        COMMAND("Command", "command"),
        DIAGNOSTIC("Diagnostic", "diagnostic"),
        FATAL("Fatal", "fatal"),
        WARNING_HIGH("WarningHigh", "warning high"),
        WARNING_LOW("WarningLow", "warning low");

        private final String tag;
        private final String text;

        Severity(String tag, String text) {
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
}
