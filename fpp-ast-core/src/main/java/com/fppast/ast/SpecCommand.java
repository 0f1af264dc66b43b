package com.fppast.ast;

import java.util.List;
import java.util.Optional;

/**
 * Command specifier
 */
public record SpecCommand(
    Kind kind,
    String name,
    List<Annotated<AstNode<FormalParam>>> params,
    Optional<AstNode<Expr>> opcode,
    Optional<AstNode<Expr>> priority,
    Optional<AstNode<QueueFull>> queueFull
) implements ComponentMember.Node {

    public enum Kind implements WireEnum {
        ASYNC("Async", "async"),
        GUARDED("Guarded", "guarded"),
        SYNC("Sync", "sync");

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
