package com.fppast.ast;

import java.util.List;

/**
 * Translation unit
 */
public record TransUnit(List<ModuleMember> members) {
}
