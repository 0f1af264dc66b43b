package com.fppast.ast;

import java.util.List;
import java.util.Optional;

/**
 * State machine definition. An absent member list declares an external state machine.
 */
public record DefStateMachine(String name, Optional<List<StateMachineMember>> members) implements ModuleMember.Node, ComponentMember.Node {
}
