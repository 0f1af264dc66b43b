package com.fppast.ast;

public record FormalParam(
    Kind kind,
    String name,
    AstNode<TypeName> typeName
) {
    public enum Kind implements WireEnum {
        REF("Ref", "ref"),
        VALUE("Value", "value");

        private final String tag;
        private final String text;

        Kind(String tag, String text) {
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
