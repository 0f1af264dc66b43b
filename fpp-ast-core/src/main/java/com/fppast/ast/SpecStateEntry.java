package com.fppast.ast;

import java.util.List;

public record SpecStateEntry(List<AstNode<String>> actions) implements StateMember.Node {
}
