package com.fppast.ast;

import java.util.List;
import java.util.Optional;

/**
 * Telemetry channel specifier
 */
public record SpecTlmChannel(
    String name,
    AstNode<TypeName> typeName,
    Optional<AstNode<Expr>> id,
    Optional<Update> update,
    Optional<AstNode<String>> format,
    List<Limit> low,
    List<Limit> high
) implements ComponentMember.Node {

    public enum Update implements WireEnum {
        ALWAYS("Always", "always"),
        ON_CHANGE("OnChange", "on change");

        private final String tag;
        private final String text;

        Update(String tag, String text) {
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
