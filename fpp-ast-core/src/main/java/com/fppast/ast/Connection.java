package com.fppast.ast;

import java.util.Optional;

/**
 * A connection in a direct graph
 */
public record Connection(
    boolean isUnmatched,
    AstNode<PortInstanceIdentifier> fromPort,
    Optional<AstNode<Expr>> fromIndex,
    AstNode<PortInstanceIdentifier> toPort,
    Optional<AstNode<Expr>> toIndex
) {
}
