package com.fppast.ast;

/**
 * Member of a module or of a translation unit
 */
public record ModuleMember(Annotated<AstNode<ModuleMember.Node>> node) {

    public sealed interface Node permits
        DefAbsType,
        DefAliasType,
        DefArray,
        DefComponent,
        DefComponentInstance,
        DefConstant,
        DefEnum,
        DefInterface,
        DefModule,
        DefPort,
        DefStateMachine,
        DefStruct,
        DefTopology {
    }
}
