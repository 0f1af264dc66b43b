package com.fppast.ast;

/**
 * Member of a component definition
 */
public record ComponentMember(Annotated<AstNode<ComponentMember.Node>> node) {

    public sealed interface Node permits
        DefAbsType,
        DefAliasType,
        DefArray,
        DefConstant,
        DefEnum,
        DefStateMachine,
        DefStruct,
        SpecCommand,
        SpecContainer,
        SpecEvent,
        SpecImport,
        SpecInternalPort,
        SpecParam,
        SpecPortInstance,
        SpecPortMatching,
        SpecRecord,
        SpecStateMachineInstance,
        SpecTlmChannel {
    }
}
