package com.fppast.ast;

import java.util.List;

public record DefState(String name, List<StateMember> members) implements StateMachineMember.Node, StateMember.Node {
}
