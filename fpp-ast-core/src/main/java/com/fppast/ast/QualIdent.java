package com.fppast.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A possibly qualified identifier such as {@code A.B.c}.
 */
public sealed interface QualIdent permits QualIdent.Unqualified, QualIdent.Qualified {

    /**
     * Flattens the identifier into its parts, outermost qualifier first.
     */
    List<String> toIdentList();

    record Unqualified(String name) implements QualIdent {
        @Override
        public List<String> toIdentList() {
            return List.of(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Qualified(AstNode<QualIdent> qualifier, AstNode<String> name) implements QualIdent {
        @Override
        public List<String> toIdentList() {
            List<String> idents = new ArrayList<>(qualifier.data().toIdentList());
            idents.add(name.data());
            return List.copyOf(idents);
        }

        @Override
        public String toString() {
            return String.join(".", toIdentList());
        }
    }
}
