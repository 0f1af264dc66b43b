package com.fppast.ast;

import com.fppast.TranslationSession;

import java.util.Objects;

/**
 * A node of the FPP AST: a payload together with the id that joins it to its location.
 *
 * @param data the payload
 * @param id the node id
 * @param <T> the payload type
 */
public record AstNode<T>(T data, int id) {

    public AstNode {
        Objects.requireNonNull(data, "data");
    }

    /**
     * Creates a node with a fresh id drawn from the session's counter.
     */
    public static <T> AstNode<T> create(T data, TranslationSession session) {
        return new AstNode<>(data, session.nextId());
    }

    /**
     * Creates a node that keeps an id carried over from the input.
     */
    public static <T> AstNode<T> createWithId(T data, int id) {
        return new AstNode<>(data, id);
    }
}
