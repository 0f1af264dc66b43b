package com.fppast.ast;

import java.util.List;

public record SpecStateExit(List<AstNode<String>> actions) implements StateMember.Node {
}
