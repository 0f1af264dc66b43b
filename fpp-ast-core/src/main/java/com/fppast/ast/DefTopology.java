package com.fppast.ast;

import java.util.List;

/**
 * Topology definition
 */
public record DefTopology(String name, List<TopologyMember> members) implements ModuleMember.Node {
}
