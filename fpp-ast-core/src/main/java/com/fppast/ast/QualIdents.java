package com.fppast.ast;

import com.fppast.InternalAstError;
import com.fppast.TranslationSession;

import java.util.List;

/**
 * Builds qualified identifiers from flat lists of identifier nodes, as a parser sees them.
 *
 * <p>The qualifier nodes synthesized along the way reuse the id of the last identifier of
 * their prefix, so a location lookup on {@code A.B} in {@code A.B.c} lands on {@code B}.</p>
 */
public final class QualIdents {

    private QualIdents() {
    }

    /**
     * Constructs a qualified identifier from a node list.
     *
     * @throws InternalAstError if the list is empty
     */
    public static QualIdent fromNodeList(List<AstNode<String>> nodeList) {
        AstNode<String> name = name(nodeList);
        List<AstNode<String>> qualifier = qualifier(nodeList);
        if (qualifier.isEmpty()) {
            return new QualIdent.Unqualified(name.data());
        }
        AstNode<QualIdent> qualifierNode = AstNode.createWithId(fromNodeList(qualifier), name(qualifier).id());
        return new QualIdent.Qualified(qualifierNode, name);
    }

    /**
     * Wraps {@link #fromNodeList} in a node with a fresh id. The new node takes the location
     * of the first identifier when the session's registry knows it.
     */
    public static AstNode<QualIdent> nodeFromNodeList(List<AstNode<String>> nodeList, TranslationSession session) {
        QualIdent qualIdent = fromNodeList(nodeList);
        AstNode<QualIdent> node = AstNode.create(qualIdent, session);
        session.locations().getOptional(nodeList.get(0).id())
            .ifPresent(loc -> session.locations().put(node.id(), loc));
        return node;
    }

    /**
     * Gets the qualifier, i.e. every identifier but the last.
     */
    public static List<AstNode<String>> qualifier(List<AstNode<String>> nodeList) {
        requireNonEmpty(nodeList);
        return List.copyOf(nodeList.subList(0, nodeList.size() - 1));
    }

    /**
     * Gets the unqualified name, i.e. the last identifier.
     */
    public static AstNode<String> name(List<AstNode<String>> nodeList) {
        requireNonEmpty(nodeList);
        return nodeList.get(nodeList.size() - 1);
    }

    private static void requireNonEmpty(List<AstNode<String>> nodeList) {
        if (nodeList.isEmpty()) {
            throw new InternalAstError("node list should not be empty");
        }
    }
}
